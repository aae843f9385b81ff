package com.nayem.tessera.plan;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.operation.ExecutionGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups compiled operations into commit units below the substrate's silent
 * rollback ceiling.
 * <p>
 * Packing is greedy and keeps batch order. An operation is never split: one
 * whose sub-commands alone exceed the ceiling gets a chunk of its own.
 * </p>
 */
public class ChunkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    public static final int DEFAULT_CEILING = 50;

    /**
     * @param operations  compiled operations in batch order
     * @param ceiling     maximum sub-commands per chunk; 0 or less means one
     *                    chunk for everything
     * @param granularity {@code per-operation} puts each operation in its own
     *                    chunk regardless of the ceiling
     */
    public ChunkPlan plan(List<CompiledOperation> operations, int ceiling, ExecutionGranularity granularity) {
        List<Chunk> chunks = new ArrayList<>();
        List<CompiledOperation> current = new ArrayList<>();
        int currentCount = 0;

        for (CompiledOperation operation : operations) {
            int count = operation.subCommandCount();
            boolean full = granularity == ExecutionGranularity.PER_OPERATION
                    || (ceiling > 0 && currentCount + count > ceiling);
            if (full && !current.isEmpty()) {
                chunks.add(new Chunk(chunks.size(), current));
                current = new ArrayList<>();
                currentCount = 0;
            }
            if (ceiling > 0 && count > ceiling) {
                log.warn("Operation {} has {} sub-commands, above the chunk ceiling of {}; committing it alone",
                        operation.opIndex(), count, ceiling);
            }
            current.add(operation);
            currentCount += count;
        }
        if (!current.isEmpty()) {
            chunks.add(new Chunk(chunks.size(), current));
        }

        log.debug("Planned {} operation(s) into {} chunk(s) (ceiling {}, {})", operations.size(), chunks.size(),
                ceiling, granularity.wireName());
        return new ChunkPlan(chunks, Math.max(ceiling, 0));
    }
}
