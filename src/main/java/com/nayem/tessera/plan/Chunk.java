package com.nayem.tessera.plan;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.model.CommitUnit;
import com.nayem.tessera.model.Primitive;

import java.util.ArrayList;
import java.util.List;

/**
 * Consecutive compiled operations submitted as one atomic commit.
 *
 * @param index      position in the plan
 * @param operations whole operations, in batch order
 */
public record Chunk(int index, List<CompiledOperation> operations) {

    public Chunk {
        operations = List.copyOf(operations);
    }

    public int subCommandCount() {
        return operations.stream().mapToInt(CompiledOperation::subCommandCount).sum();
    }

    public int firstOpIndex() {
        return operations.get(0).opIndex();
    }

    public int lastOpIndex() {
        return operations.get(operations.size() - 1).opIndex();
    }

    /**
     * Commit unit carrying every mutating primitive of the chunk.
     */
    public CommitUnit toCommitUnit() {
        List<Primitive> primitives = new ArrayList<>();
        for (CompiledOperation operation : operations) {
            primitives.addAll(operation.mutations());
        }
        return new CommitUnit("batch chunk " + index + " (ops " + firstOpIndex() + ".." + lastOpIndex() + ")",
                primitives);
    }
}
