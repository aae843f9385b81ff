package com.nayem.tessera.support;

import com.nayem.tessera.operation.DuplicateStrategy;
import com.nayem.tessera.operation.Operation;

import java.util.Map;

/**
 * Shorthand constructors for the operations tests use most.
 */
public final class Ops {

    private Ops() {
    }

    public static Operation.CreateElement createElement(String tempId, String type, String name) {
        return new Operation.CreateElement(tempId, type, name, null, null, null, null);
    }

    public static Operation.CreateElement createElement(String tempId, String type, String name,
            DuplicateStrategy onDuplicate) {
        return new Operation.CreateElement(tempId, type, name, null, null, null, onDuplicate);
    }

    public static Operation.CreateElement createElement(String tempId, String type, String name,
            Map<String, String> properties) {
        return new Operation.CreateElement(tempId, type, name, null, properties, null, null);
    }

    public static Operation.CreateRelationship createRelationship(String tempId, String type, String sourceId,
            String targetId) {
        return new Operation.CreateRelationship(tempId, type, sourceId, targetId, null, null, null, null, null,
                null);
    }

    public static Operation.CreateView createView(String tempId, String name) {
        return new Operation.CreateView(tempId, name, null, null, null);
    }

    public static Operation.AddToView addToView(String tempId, String viewId, String elementId) {
        return new Operation.AddToView(tempId, viewId, elementId, null, null, null, null, null);
    }

    public static Operation.AddConnectionToView connect(String tempId, String viewId, String relationshipId,
            String sourceVisualId, String targetVisualId) {
        return new Operation.AddConnectionToView(tempId, viewId, relationshipId, sourceVisualId, targetVisualId,
                null, null, null);
    }

    public static Operation.UpdateElement rename(String id, String name) {
        return new Operation.UpdateElement(id, name, null, null);
    }
}
