package com.nayem.tessera.model;

import java.util.Map;

/**
 * Read-only snapshot of a committed model object.
 *
 * @param id          committed identity
 * @param kind        structural kind
 * @param type        ArchiMate type for concepts, {@code note}/{@code group}/
 *                    {@code element} for diagram objects, the folder type for
 *                    root folders
 * @param name        display name, may be null
 * @param containerId owning folder, view or parent diagram object
 * @param viewId      owning view for diagram objects and connections
 * @param conceptId   referenced concept for diagram objects and connections
 * @param sourceId    source element (relationships) or source diagram object
 *                    (connections)
 * @param targetId    target element or target diagram object
 * @param properties  user properties
 * @param attributes  remaining fields (documentation, bounds, style, ...)
 */
public record ModelObject(
        String id,
        ObjectKind kind,
        String type,
        String name,
        String containerId,
        String viewId,
        String conceptId,
        String sourceId,
        String targetId,
        Map<String, String> properties,
        Map<String, Object> attributes) {

    public ModelObject {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Object attribute(String field) {
        return attributes.get(field);
    }

    public String documentation() {
        Object value = attributes.get(Fields.DOCUMENTATION);
        return value != null ? value.toString() : null;
    }
}
