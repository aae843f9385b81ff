package com.nayem.tessera.compile;

import com.nayem.tessera.model.Fields;
import com.nayem.tessera.model.ModelObject;
import com.nayem.tessera.model.ObjectKind;
import com.nayem.tessera.model.ObjectRef;

/**
 * What compilation knows about an object, whether it is committed or only
 * created earlier in the batch. References are expressed as {@link ObjectRef}
 * so committed and pending objects compare uniformly.
 */
record KnownObject(
        ObjectRef ref,
        ObjectKind kind,
        String type,
        String name,
        ObjectRef source,
        ObjectRef target,
        ObjectRef concept,
        ObjectRef view,
        String accessType,
        String strength) {

    static KnownObject of(ModelObject object) {
        return new KnownObject(
                ObjectRef.committed(object.id()),
                object.kind(),
                object.type(),
                object.name(),
                committedOrNull(object.sourceId()),
                committedOrNull(object.targetId()),
                committedOrNull(object.conceptId()),
                committedOrNull(object.viewId()),
                (String) object.attribute(Fields.ACCESS_TYPE),
                (String) object.attribute(Fields.STRENGTH));
    }

    private static ObjectRef committedOrNull(String id) {
        return id == null ? null : ObjectRef.committed(id);
    }
}
