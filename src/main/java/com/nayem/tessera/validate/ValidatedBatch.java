package com.nayem.tessera.validate;

import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.DuplicateStrategy;
import com.nayem.tessera.operation.ExecutionGranularity;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.tempid.TempIdTable;

import java.util.List;

/**
 * A batch that passed validation, with everything later stages need resolved
 * up front.
 *
 * @param batch       the original request
 * @param strategies  effective duplicate strategy per operation index
 * @param tempIds     table with every tempId registered, none resolved yet
 * @param granularity effective chunking mode
 */
public record ValidatedBatch(
        Batch batch,
        List<DuplicateStrategy> strategies,
        TempIdTable tempIds,
        ExecutionGranularity granularity) {

    public List<Operation> operations() {
        return batch.changes();
    }

    public Operation operation(int index) {
        return batch.changes().get(index);
    }

    public DuplicateStrategy strategy(int index) {
        return strategies.get(index);
    }

    public int size() {
        return batch.changes().size();
    }
}
