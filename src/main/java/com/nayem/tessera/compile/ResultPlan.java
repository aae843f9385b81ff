package com.nayem.tessera.compile;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.tempid.MappingKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the result of an operation will look like once its chunk commits.
 * Holds references, never ids: ids are read back from committed state.
 *
 * @param status      status the operation reports if its chunk commits
 * @param subject     object whose committed id becomes the result's resolved id
 * @param tempId      client tempId bound to the subject, if any
 * @param mappingKind kind reported for the tempId
 * @param warnings    non-fatal notes, e.g. swapped endpoints
 * @param detailRefs  further objects whose committed ids are reported by name
 * @param details     fixed detail values known at compile time
 * @param skipReason  reason code when the status is {@code skipped}
 * @param error       structured error for skipped operations
 */
public record ResultPlan(
        OperationStatus status,
        ObjectRef subject,
        String tempId,
        MappingKind mappingKind,
        List<String> warnings,
        Map<String, ObjectRef> detailRefs,
        Map<String, String> details,
        String skipReason,
        EngineError error) {

    public static Builder builder(OperationStatus status) {
        return new Builder(status);
    }

    public static final class Builder {
        private final OperationStatus status;
        private ObjectRef subject;
        private String tempId;
        private MappingKind mappingKind;
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, ObjectRef> detailRefs = new LinkedHashMap<>();
        private final Map<String, String> details = new LinkedHashMap<>();
        private String skipReason;
        private EngineError error;

        private Builder(OperationStatus status) {
            this.status = status;
        }

        public Builder subject(ObjectRef subject) {
            this.subject = subject;
            return this;
        }

        public Builder tempId(String tempId, MappingKind kind) {
            this.tempId = tempId;
            this.mappingKind = kind;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder detailRef(String key, ObjectRef ref) {
            if (ref != null) {
                this.detailRefs.put(key, ref);
            }
            return this;
        }

        public Builder detail(String key, String value) {
            if (value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public Builder skipped(String skipReason, EngineError error) {
            this.skipReason = skipReason;
            this.error = error;
            return this;
        }

        public ResultPlan build() {
            return new ResultPlan(status, subject, tempId, mappingKind, List.copyOf(warnings),
                    Collections.unmodifiableMap(new LinkedHashMap<>(detailRefs)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(details)), skipReason, error);
        }
    }
}
