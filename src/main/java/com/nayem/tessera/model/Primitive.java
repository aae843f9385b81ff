package com.nayem.tessera.model;

/**
 * One indivisible mutation understood by the substrate. A logical operation
 * compiles to an ordered list of these.
 */
public sealed interface Primitive permits Primitive.SetField, Primitive.SetProperty, Primitive.AddToFolder,
        Primitive.AddToView, Primitive.Remove, Primitive.ResolvedExisting {

    static Primitive setField(ObjectRef target, String field, Object value) {
        return new SetField(target, field, value);
    }

    static Primitive setProperty(ObjectRef target, String key, String value) {
        return new SetProperty(target, key, value);
    }

    static Primitive addToFolder(ObjectRef object, ObjectRef folder) {
        return new AddToFolder(object, folder);
    }

    static Primitive addToView(ObjectRef object, ObjectRef container) {
        return new AddToView(object, container);
    }

    static Primitive remove(ObjectRef target) {
        return new Remove(target);
    }

    static Primitive resolvedExisting(ObjectRef existing) {
        return new ResolvedExisting(existing);
    }

    /**
     * Whether this primitive changes the model. Non-mutating markers are never
     * submitted and do not count towards the chunk ceiling.
     */
    default boolean mutating() {
        return true;
    }

    /**
     * The object this primitive acts on.
     */
    ObjectRef subject();

    /**
     * Assigns a field. {@code value} is a String, Integer, {@link Bounds} or,
     * for reference fields, an {@link ObjectRef}.
     */
    record SetField(ObjectRef target, String field, Object value) implements Primitive {
        @Override
        public ObjectRef subject() {
            return target;
        }
    }

    record SetProperty(ObjectRef target, String key, String value) implements Primitive {
        @Override
        public ObjectRef subject() {
            return target;
        }
    }

    /**
     * Places the object in a folder, detaching it from its current one.
     */
    record AddToFolder(ObjectRef object, ObjectRef folder) implements Primitive {
        @Override
        public ObjectRef subject() {
            return object;
        }
    }

    /**
     * Places a diagram object or connection in a view, or nests a diagram object
     * in another one.
     */
    record AddToView(ObjectRef object, ObjectRef container) implements Primitive {
        @Override
        public ObjectRef subject() {
            return object;
        }
    }

    /**
     * Removes the object and everything it contains. Removing an absent object
     * is a no-op.
     */
    record Remove(ObjectRef target) implements Primitive {
        @Override
        public ObjectRef subject() {
            return target;
        }
    }

    /**
     * Zero-mutation marker: the operation resolved to an object that already
     * exists.
     */
    record ResolvedExisting(ObjectRef existing) implements Primitive {
        @Override
        public boolean mutating() {
            return false;
        }

        @Override
        public ObjectRef subject() {
            return existing;
        }
    }
}
