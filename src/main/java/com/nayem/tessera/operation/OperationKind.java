package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.nayem.tessera.tempid.MappingKind;

/**
 * Discriminator of {@link Operation}. The wire name is the {@code op} field of
 * the request.
 */
public enum OperationKind {
    CREATE_ELEMENT("createElement", MappingKind.CONCEPT, true),
    CREATE_RELATIONSHIP("createRelationship", MappingKind.CONCEPT, true),
    CREATE_OR_GET_ELEMENT("createOrGetElement", MappingKind.CONCEPT, true),
    CREATE_OR_GET_RELATIONSHIP("createOrGetRelationship", MappingKind.CONCEPT, true),
    UPDATE_ELEMENT("updateElement", null, false),
    UPDATE_RELATIONSHIP("updateRelationship", null, false),
    DELETE_ELEMENT("deleteElement", null, false),
    DELETE_RELATIONSHIP("deleteRelationship", null, false),
    SET_PROPERTY("setProperty", null, false),
    MOVE_TO_FOLDER("moveToFolder", null, false),
    CREATE_FOLDER("createFolder", MappingKind.FOLDER, false),
    ADD_TO_VIEW("addToView", MappingKind.VISUAL, false),
    ADD_CONNECTION_TO_VIEW("addConnectionToView", MappingKind.CONNECTION, false),
    NEST_IN_VIEW("nestInView", null, false),
    STYLE_VIEW_OBJECT("styleViewObject", null, false),
    STYLE_CONNECTION("styleConnection", null, false),
    MOVE_VIEW_OBJECT("moveViewObject", null, false),
    CREATE_NOTE("createNote", MappingKind.VISUAL, false),
    CREATE_GROUP("createGroup", MappingKind.VISUAL, false),
    CREATE_VIEW("createView", MappingKind.VIEW, false),
    DELETE_VIEW("deleteView", null, false),
    DELETE_CONNECTION_FROM_VIEW("deleteConnectionFromView", null, false);

    private final String wireName;
    private final MappingKind creates;
    private final boolean duplicateAware;

    OperationKind(String wireName, MappingKind creates, boolean duplicateAware) {
        this.wireName = wireName;
        this.creates = creates;
        this.duplicateAware = duplicateAware;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Kind of object a tempId on this operation stands for, or null when the
     * operation creates nothing.
     */
    public MappingKind creates() {
        return creates;
    }

    /**
     * Whether a duplicate strategy applies to this operation.
     */
    public boolean duplicateAware() {
        return duplicateAware;
    }
}
