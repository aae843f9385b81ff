package com.nayem.tessera.plan;

import java.util.List;

/**
 * Ordered chunks covering every compiled operation exactly once.
 *
 * @param chunks  chunks in commit order
 * @param ceiling sub-command ceiling the plan was built for, 0 when unlimited
 */
public record ChunkPlan(List<Chunk> chunks, int ceiling) {

    public ChunkPlan {
        chunks = List.copyOf(chunks);
    }

    public int size() {
        return chunks.size();
    }

    public int totalSubCommands() {
        return chunks.stream().mapToInt(Chunk::subCommandCount).sum();
    }
}
