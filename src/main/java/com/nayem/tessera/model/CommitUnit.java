package com.nayem.tessera.model;

import java.util.List;

/**
 * Primitives submitted as one atomic commit.
 *
 * @param label      human readable label, shown in the substrate's history
 * @param primitives mutating primitives in execution order
 */
public record CommitUnit(String label, List<Primitive> primitives) {

    public CommitUnit {
        primitives = List.copyOf(primitives);
    }

    public int size() {
        return primitives.size();
    }
}
