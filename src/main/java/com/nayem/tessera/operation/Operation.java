package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nayem.tessera.tempid.MappingKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One logical graph mutation in a batch.
 * <p>
 * Closed set of kinds; every consumer switches over {@link #kind()} so adding a
 * kind fails compilation until it is handled everywhere.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Operation.CreateElement.class, name = "createElement"),
        @JsonSubTypes.Type(value = Operation.CreateRelationship.class, name = "createRelationship"),
        @JsonSubTypes.Type(value = Operation.CreateOrGetElement.class, name = "createOrGetElement"),
        @JsonSubTypes.Type(value = Operation.CreateOrGetRelationship.class, name = "createOrGetRelationship"),
        @JsonSubTypes.Type(value = Operation.UpdateElement.class, name = "updateElement"),
        @JsonSubTypes.Type(value = Operation.UpdateRelationship.class, name = "updateRelationship"),
        @JsonSubTypes.Type(value = Operation.DeleteElement.class, name = "deleteElement"),
        @JsonSubTypes.Type(value = Operation.DeleteRelationship.class, name = "deleteRelationship"),
        @JsonSubTypes.Type(value = Operation.SetProperty.class, name = "setProperty"),
        @JsonSubTypes.Type(value = Operation.MoveToFolder.class, name = "moveToFolder"),
        @JsonSubTypes.Type(value = Operation.CreateFolder.class, name = "createFolder"),
        @JsonSubTypes.Type(value = Operation.AddToView.class, name = "addToView"),
        @JsonSubTypes.Type(value = Operation.AddConnectionToView.class, name = "addConnectionToView"),
        @JsonSubTypes.Type(value = Operation.NestInView.class, name = "nestInView"),
        @JsonSubTypes.Type(value = Operation.StyleViewObject.class, name = "styleViewObject"),
        @JsonSubTypes.Type(value = Operation.StyleConnection.class, name = "styleConnection"),
        @JsonSubTypes.Type(value = Operation.MoveViewObject.class, name = "moveViewObject"),
        @JsonSubTypes.Type(value = Operation.CreateNote.class, name = "createNote"),
        @JsonSubTypes.Type(value = Operation.CreateGroup.class, name = "createGroup"),
        @JsonSubTypes.Type(value = Operation.CreateView.class, name = "createView"),
        @JsonSubTypes.Type(value = Operation.DeleteView.class, name = "deleteView"),
        @JsonSubTypes.Type(value = Operation.DeleteConnectionFromView.class, name = "deleteConnectionFromView")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Operation {

    OperationKind kind();

    /**
     * Client placeholder for the object this operation creates, if any.
     */
    default String tempId() {
        return null;
    }

    /**
     * Per-operation duplicate strategy override.
     */
    default DuplicateStrategy onDuplicate() {
        return null;
    }

    /**
     * Fields that point at other objects, in declaration order. Null values are
     * omitted.
     */
    default List<Reference> references() {
        return List.of();
    }

    private static List<Reference> refs(Reference... candidates) {
        List<Reference> present = new ArrayList<>();
        for (Reference candidate : candidates) {
            if (candidate.value() != null) {
                present.add(candidate);
            }
        }
        return present;
    }

    record CreateElement(String tempId, String type, String name, String documentation,
            Map<String, String> properties, String folderId, DuplicateStrategy onDuplicate) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_ELEMENT;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("folderId", folderId, MappingKind.FOLDER));
        }
    }

    record CreateRelationship(String tempId, String type, String sourceId, String targetId, String name,
            String documentation, String accessType, String strength, Map<String, String> properties,
            DuplicateStrategy onDuplicate) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_RELATIONSHIP;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("sourceId", sourceId, MappingKind.CONCEPT),
                    Reference.to("targetId", targetId, MappingKind.CONCEPT));
        }
    }

    record ElementSpec(String type, String name, String documentation, Map<String, String> properties,
            String folderId) {
    }

    record ElementMatch(String type, String name) {
    }

    record CreateOrGetElement(String tempId, ElementSpec create, ElementMatch match,
            DuplicateStrategy onDuplicate) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_OR_GET_ELEMENT;
        }

        @Override
        public List<Reference> references() {
            return create == null ? List.of()
                    : refs(Reference.to("create.folderId", create.folderId(), MappingKind.FOLDER));
        }

        /**
         * Match criteria, falling back to the create spec for absent fields.
         */
        public ElementMatch effectiveMatch() {
            String type = match != null && match.type() != null ? match.type() : create.type();
            String name = match != null && match.name() != null ? match.name() : create.name();
            return new ElementMatch(type, name);
        }
    }

    record RelationshipSpec(String type, String sourceId, String targetId, String name, String documentation,
            String accessType, String strength, Map<String, String> properties) {
    }

    record RelationshipMatch(String type, String sourceId, String targetId, String accessType, String strength) {
    }

    record CreateOrGetRelationship(String tempId, RelationshipSpec create, RelationshipMatch match,
            DuplicateStrategy onDuplicate) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_OR_GET_RELATIONSHIP;
        }

        @Override
        public List<Reference> references() {
            List<Reference> result = new ArrayList<>();
            if (create != null) {
                result.addAll(refs(Reference.to("create.sourceId", create.sourceId(), MappingKind.CONCEPT),
                        Reference.to("create.targetId", create.targetId(), MappingKind.CONCEPT)));
            }
            if (match != null) {
                result.addAll(refs(Reference.to("match.sourceId", match.sourceId(), MappingKind.CONCEPT),
                        Reference.to("match.targetId", match.targetId(), MappingKind.CONCEPT)));
            }
            return result;
        }

        public RelationshipMatch effectiveMatch() {
            RelationshipMatch m = match != null ? match : new RelationshipMatch(null, null, null, null, null);
            return new RelationshipMatch(
                    m.type() != null ? m.type() : create.type(),
                    m.sourceId() != null ? m.sourceId() : create.sourceId(),
                    m.targetId() != null ? m.targetId() : create.targetId(),
                    m.accessType(),
                    m.strength());
        }
    }

    record UpdateElement(String id, String name, String documentation, Map<String, String> properties)
            implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.UPDATE_ELEMENT;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT));
        }
    }

    record UpdateRelationship(String id, String name, String documentation, Map<String, String> properties)
            implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.UPDATE_RELATIONSHIP;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT));
        }
    }

    record DeleteElement(String id, Boolean cascade) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.DELETE_ELEMENT;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT));
        }

        public boolean cascading() {
            return cascade == null || cascade;
        }
    }

    record DeleteRelationship(String id) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.DELETE_RELATIONSHIP;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT));
        }
    }

    record SetProperty(String id, String key, String value) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.SET_PROPERTY;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT, MappingKind.VIEW));
        }
    }

    record MoveToFolder(String id, String folderId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.MOVE_TO_FOLDER;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("id", id, MappingKind.CONCEPT, MappingKind.VIEW, MappingKind.FOLDER),
                    Reference.to("folderId", folderId, MappingKind.FOLDER));
        }
    }

    record CreateFolder(String tempId, String name, String parentId, String parentType, String parentFolder,
            String documentation) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_FOLDER;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("parentId", parentId, MappingKind.FOLDER));
        }
    }

    record AddToView(String tempId, String viewId, String elementId, Integer x, Integer y, Integer width,
            Integer height, String parentVisualId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.ADD_TO_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("elementId", elementId, MappingKind.CONCEPT),
                    Reference.to("parentVisualId", parentVisualId, MappingKind.VISUAL));
        }
    }

    record AddConnectionToView(String tempId, String viewId, String relationshipId, String sourceVisualId,
            String targetVisualId, Boolean autoSwapDirection, Boolean autoResolveVisuals,
            Boolean skipExistingConnections) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.ADD_CONNECTION_TO_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("relationshipId", relationshipId, MappingKind.CONCEPT),
                    Reference.to("sourceVisualId", sourceVisualId, MappingKind.VISUAL),
                    Reference.to("targetVisualId", targetVisualId, MappingKind.VISUAL));
        }

        public boolean swapAllowed() {
            return Boolean.TRUE.equals(autoSwapDirection);
        }

        public boolean resolveVisuals() {
            return Boolean.TRUE.equals(autoResolveVisuals);
        }

        public boolean skipExisting() {
            return Boolean.TRUE.equals(skipExistingConnections);
        }
    }

    record NestInView(String viewId, String visualId, String parentVisualId, Integer x, Integer y)
            implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.NEST_IN_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("visualId", visualId, MappingKind.VISUAL),
                    Reference.to("parentVisualId", parentVisualId, MappingKind.VISUAL));
        }
    }

    record StyleViewObject(String viewObjectId, String fillColor, String lineColor, String fontColor,
            String font, Integer opacity, Integer lineWidth) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.STYLE_VIEW_OBJECT;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewObjectId", viewObjectId, MappingKind.VISUAL));
        }
    }

    record StyleConnection(String connectionId, String lineColor, String fontColor, String font,
            Integer lineWidth, Integer textPosition) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.STYLE_CONNECTION;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("connectionId", connectionId, MappingKind.CONNECTION));
        }
    }

    record MoveViewObject(String viewObjectId, Integer x, Integer y, Integer width, Integer height)
            implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.MOVE_VIEW_OBJECT;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewObjectId", viewObjectId, MappingKind.VISUAL));
        }
    }

    record CreateNote(String tempId, String viewId, String content, Integer x, Integer y, Integer width,
            Integer height, String parentVisualId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_NOTE;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("parentVisualId", parentVisualId, MappingKind.VISUAL));
        }
    }

    record CreateGroup(String tempId, String viewId, String name, String documentation, Integer x, Integer y,
            Integer width, Integer height, String parentVisualId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_GROUP;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("parentVisualId", parentVisualId, MappingKind.VISUAL));
        }
    }

    record CreateView(String tempId, String name, String viewpoint, String documentation, String folderId)
            implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.CREATE_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("folderId", folderId, MappingKind.FOLDER));
        }
    }

    record DeleteView(String viewId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.DELETE_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW));
        }
    }

    record DeleteConnectionFromView(String viewId, String connectionId) implements Operation {

        @Override
        public OperationKind kind() {
            return OperationKind.DELETE_CONNECTION_FROM_VIEW;
        }

        @Override
        public List<Reference> references() {
            return refs(Reference.to("viewId", viewId, MappingKind.VIEW),
                    Reference.to("connectionId", connectionId, MappingKind.CONNECTION));
        }
    }
}
