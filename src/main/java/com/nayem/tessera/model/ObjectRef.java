package com.nayem.tessera.model;

/**
 * Reference to a model object from inside a primitive: either an object that
 * is already committed, or a provisional object created earlier in the same
 * batch.
 */
public sealed interface ObjectRef permits ObjectRef.Committed, ObjectRef.Provisional {

    static ObjectRef committed(String id) {
        return new Committed(id);
    }

    static ObjectRef provisional(ProvisionalObject object) {
        return new Provisional(object);
    }

    record Committed(String id) implements ObjectRef {
        @Override
        public String toString() {
            return id;
        }
    }

    record Provisional(ProvisionalObject object) implements ObjectRef {
        @Override
        public String toString() {
            return object.toString();
        }
    }
}
