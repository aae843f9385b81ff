package com.nayem.tessera.execute;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.operation.OperationKind;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.tempid.MappingKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one operation, built from post-commit state.
 *
 * @param opIndex     position in the batch
 * @param op          operation kind
 * @param status      what happened
 * @param resolvedId  committed id of the object the operation produced or acted on
 * @param tempId      client tempId carried by the operation
 * @param mappingKind kind of object the tempId maps to
 * @param skipReason  error code name when skipped
 * @param warnings    non-fatal notes
 * @param details     display fields read after commit
 * @param error       structured error for skipped or unexecuted operations
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OperationResult(
        int opIndex,
        OperationKind op,
        OperationStatus status,
        String resolvedId,
        String tempId,
        MappingKind mappingKind,
        String skipReason,
        List<String> warnings,
        Map<String, String> details,
        EngineError error) {

    public OperationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static OperationResult unexecuted(int opIndex, OperationKind op, String tempId, MappingKind mappingKind,
            EngineError error) {
        return new OperationResult(opIndex, op, OperationStatus.UNEXECUTED, null, tempId, mappingKind, null,
                List.of(), Map.of(), error);
    }

    public boolean executed() {
        return status.executed();
    }
}
