package com.nayem.tessera.model;

/**
 * Structural kind of a model object.
 */
public enum ObjectKind {
    FOLDER,
    ELEMENT,
    RELATIONSHIP,
    VIEW,
    /**
     * Any object placed on a view: element reference, note or group.
     */
    DIAGRAM_OBJECT,
    CONNECTION;

    public boolean isConcept() {
        return this == ELEMENT || this == RELATIONSHIP;
    }
}
