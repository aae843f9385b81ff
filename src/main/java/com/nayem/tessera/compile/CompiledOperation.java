package com.nayem.tessera.compile;

import com.nayem.tessera.model.Primitive;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.operation.OperationStatus;

import java.util.List;

/**
 * A validated operation turned into substrate primitives. Indivisible: chunk
 * planning never separates its sub-commands.
 *
 * @param opIndex     position of the source operation in the batch
 * @param source      the operation as submitted
 * @param subCommands ordered primitives, markers included
 * @param plan        result to report once committed
 */
public record CompiledOperation(int opIndex, Operation source, List<Primitive> subCommands, ResultPlan plan) {

    public CompiledOperation {
        subCommands = List.copyOf(subCommands);
    }

    /**
     * Number of mutating primitives. This is what counts against the chunk
     * ceiling.
     */
    public int subCommandCount() {
        return (int) subCommands.stream().filter(Primitive::mutating).count();
    }

    public List<Primitive> mutations() {
        return subCommands.stream().filter(Primitive::mutating).toList();
    }

    public boolean isSkipped() {
        return plan.status() == OperationStatus.SKIPPED;
    }
}
