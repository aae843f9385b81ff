package com.nayem.tessera.validate;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.model.FolderType;
import com.nayem.tessera.model.ModelObject;
import com.nayem.tessera.model.ModelReader;
import com.nayem.tessera.operation.ArchimateTypes;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.DuplicateStrategy;
import com.nayem.tessera.operation.ExecutionGranularity;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.operation.Operation.AddConnectionToView;
import com.nayem.tessera.operation.Operation.AddToView;
import com.nayem.tessera.operation.Operation.CreateElement;
import com.nayem.tessera.operation.Operation.CreateFolder;
import com.nayem.tessera.operation.Operation.CreateGroup;
import com.nayem.tessera.operation.Operation.CreateNote;
import com.nayem.tessera.operation.Operation.CreateOrGetElement;
import com.nayem.tessera.operation.Operation.CreateOrGetRelationship;
import com.nayem.tessera.operation.Operation.CreateRelationship;
import com.nayem.tessera.operation.Operation.CreateView;
import com.nayem.tessera.operation.Operation.MoveViewObject;
import com.nayem.tessera.operation.Operation.NestInView;
import com.nayem.tessera.operation.Operation.StyleConnection;
import com.nayem.tessera.operation.Operation.StyleViewObject;
import com.nayem.tessera.operation.OperationKind;
import com.nayem.tessera.operation.Reference;
import com.nayem.tessera.tempid.MappingKind;
import com.nayem.tessera.tempid.TempIdEntry;
import com.nayem.tessera.tempid.TempIdTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validation of a batch and construction of its tempId table.
 * <p>
 * Runs in three passes: operation count, per-kind fields and ranges, then the
 * tempId graph in original order. The first violation ends validation; there
 * is no partial result. Reads the model only to check literal ids.
 * </p>
 */
public class BatchValidator {

    public static final int HARD_MAX_CHANGES = 1000;

    private static final Pattern IDEMPOTENCY_KEY = Pattern.compile("^[A-Za-z0-9:_-]{1,128}$");
    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final Set<String> ACCESS_TYPES = Set.of("write", "read", "access", "readwrite");

    private final ModelReader model;
    private final int maxChanges;
    private final ExecutionGranularity defaultGranularity;

    public BatchValidator(ModelReader model) {
        this(model, HARD_MAX_CHANGES, ExecutionGranularity.PER_BATCH_CHUNKING);
    }

    public BatchValidator(ModelReader model, int maxChanges, ExecutionGranularity defaultGranularity) {
        if (maxChanges < 1 || maxChanges > HARD_MAX_CHANGES) {
            throw new IllegalArgumentException("maxChanges must be between 1 and " + HARD_MAX_CHANGES);
        }
        this.model = model;
        this.maxChanges = maxChanges;
        this.defaultGranularity = defaultGranularity;
    }

    /**
     * Checks only the idempotency key format. Used at ingress, before the key is
     * reserved.
     */
    public static Optional<EngineError> checkIdempotencyKey(String key) {
        if (key == null || IDEMPOTENCY_KEY.matcher(key).matches()) {
            return Optional.empty();
        }
        return Optional.of(new EngineError(ErrorCode.VALIDATION_ERROR,
                "idempotencyKey must match " + IDEMPOTENCY_KEY.pattern(), null, "/idempotencyKey",
                "idempotencyKey", key, "Use 1-128 characters from letters, digits, ':', '_' and '-'"));
    }

    public Result<ValidatedBatch> validate(Batch batch) {
        List<Operation> changes = batch.changes();
        if (changes == null || changes.isEmpty()) {
            return Result.err(new EngineError(ErrorCode.VALIDATION_ERROR, "changes must contain at least one operation",
                    null, "/changes", "changes", null, null));
        }
        if (changes.size() > maxChanges) {
            return Result.err(new EngineError(ErrorCode.VALIDATION_ERROR,
                    "changes contains " + changes.size() + " operations, maximum is " + maxChanges,
                    null, "/changes", "changes", null, "Split the batch into several requests"));
        }
        Optional<EngineError> keyError = checkIdempotencyKey(batch.idempotencyKey());
        if (keyError.isPresent()) {
            return Result.err(keyError.get());
        }

        List<DuplicateStrategy> strategies = new ArrayList<>(changes.size());
        for (int i = 0; i < changes.size(); i++) {
            Operation op = changes.get(i);
            if (op == null) {
                return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, i, null, "Operation is null"));
            }
            EngineError fieldError = checkFields(i, op);
            if (fieldError != null) {
                return Result.err(fieldError);
            }
            DuplicateStrategy strategy = effectiveStrategy(op, batch.duplicateStrategy());
            if (strategy == DuplicateStrategy.RENAME && op.kind() == OperationKind.CREATE_OR_GET_RELATIONSHIP) {
                return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, i, "onDuplicate",
                        "Duplicate strategy 'rename' is not supported for createOrGetRelationship")
                        .withHint("Use 'error' or 'reuse'"));
            }
            strategies.add(strategy);
        }

        Result<TempIdTable> table = buildTempIdTable(changes);
        if (!table.isOk()) {
            return Result.err(table.error());
        }
        ExecutionGranularity granularity = batch.granularity() != null ? batch.granularity() : defaultGranularity;
        return Result.ok(new ValidatedBatch(batch, List.copyOf(strategies), table.value(), granularity));
    }

    /**
     * Operation override, then batch default, then {@code error}.
     */
    static DuplicateStrategy effectiveStrategy(Operation op, DuplicateStrategy batchDefault) {
        if (op.onDuplicate() != null) {
            return op.onDuplicate();
        }
        return batchDefault != null ? batchDefault : DuplicateStrategy.ERROR;
    }

    private Result<TempIdTable> buildTempIdTable(List<Operation> changes) {
        Map<String, Integer> declaredAt = new HashMap<>();
        for (int i = 0; i < changes.size(); i++) {
            String tempId = changes.get(i).tempId();
            if (tempId != null) {
                declaredAt.putIfAbsent(tempId, i);
            }
        }

        TempIdTable table = new TempIdTable();
        for (int i = 0; i < changes.size(); i++) {
            Operation op = changes.get(i);
            for (Reference reference : op.references()) {
                EngineError error = checkReference(i, reference, table, declaredAt);
                if (error != null) {
                    return Result.err(error);
                }
            }
            String tempId = op.tempId();
            if (tempId == null) {
                continue;
            }
            if (tempId.isBlank()) {
                return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, i, "tempId", "tempId must not be blank"));
            }
            if (!table.register(tempId, op.kind().creates(), i, op.kind())) {
                int first = table.lookup(tempId).map(TempIdEntry::definedAt).orElse(-1);
                return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, i, "tempId",
                        "tempId '" + tempId + "' is already defined by operation " + first)
                        .withReference(tempId)
                        .withHint("Every tempId must be unique within a batch"));
            }
        }
        return Result.ok(table);
    }

    private EngineError checkReference(int opIndex, Reference reference, TempIdTable table,
            Map<String, Integer> declaredAt) {
        String value = reference.value();
        Optional<TempIdEntry> entry = table.lookup(value);
        if (entry.isPresent()) {
            MappingKind kind = entry.get().kind();
            if (!reference.accepts().contains(kind)) {
                return EngineError.at(ErrorCode.VALIDATION_ERROR, opIndex, reference.field(),
                        "Field '" + reference.field() + "' expects " + describe(reference.accepts())
                                + " but tempId '" + value + "' refers to a " + kind.wireName())
                        .withReference(value);
            }
            return null;
        }

        Integer laterDeclaration = declaredAt.get(value);
        if (laterDeclaration != null) {
            String hint = laterDeclaration == opIndex
                    ? "An operation cannot reference its own tempId"
                    : "tempId '" + value + "' is defined by operation " + laterDeclaration
                            + "; move that operation before operation " + opIndex;
            return unresolved(opIndex, reference, hint);
        }

        Optional<ModelObject> existing = model.findById(value);
        if (existing.isEmpty()) {
            return unresolved(opIndex, reference,
                    "'" + value + "' is neither a tempId defined earlier in this batch nor an existing object id");
        }
        MappingKind kind = MappingKind.of(existing.get().kind());
        if (!reference.accepts().contains(kind)) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, opIndex, reference.field(),
                    "Field '" + reference.field() + "' expects " + describe(reference.accepts())
                            + " but '" + value + "' is a " + kind.wireName())
                    .withReference(value);
        }
        return null;
    }

    private static EngineError unresolved(int opIndex, Reference reference, String hint) {
        return EngineError.at(ErrorCode.UNRESOLVED_TEMP_ID, opIndex, reference.field(),
                "Cannot resolve reference '" + reference.value() + "' in field '" + reference.field() + "'")
                .withReference(reference.value())
                .withHint(hint);
    }

    private static String describe(Set<MappingKind> kinds) {
        List<String> names = kinds.stream().map(MappingKind::wireName).toList();
        return names.size() == 1 ? "a " + names.get(0) : "one of " + names;
    }

    private EngineError checkFields(int i, Operation op) {
        return switch (op.kind()) {
            case CREATE_ELEMENT -> checkCreateElement(i, (CreateElement) op);
            case CREATE_RELATIONSHIP -> checkCreateRelationship(i, (CreateRelationship) op);
            case CREATE_OR_GET_ELEMENT -> checkCreateOrGetElement(i, (CreateOrGetElement) op);
            case CREATE_OR_GET_RELATIONSHIP -> checkCreateOrGetRelationship(i, (CreateOrGetRelationship) op);
            case UPDATE_ELEMENT -> {
                Operation.UpdateElement update = (Operation.UpdateElement) op;
                yield checkUpdate(i, update.id(), update.name(), update.documentation(), update.properties());
            }
            case UPDATE_RELATIONSHIP -> {
                Operation.UpdateRelationship update = (Operation.UpdateRelationship) op;
                yield checkUpdate(i, update.id(), update.name(), update.documentation(), update.properties());
            }
            case DELETE_ELEMENT -> required(i, "id", ((Operation.DeleteElement) op).id());
            case DELETE_RELATIONSHIP -> required(i, "id", ((Operation.DeleteRelationship) op).id());
            case SET_PROPERTY -> {
                Operation.SetProperty set = (Operation.SetProperty) op;
                EngineError error = first(required(i, "id", set.id()), required(i, "key", set.key()));
                if (error == null && set.value() == null) {
                    error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, "value", "value is required");
                }
                yield error;
            }
            case MOVE_TO_FOLDER -> {
                Operation.MoveToFolder move = (Operation.MoveToFolder) op;
                yield first(required(i, "id", move.id()), required(i, "folderId", move.folderId()));
            }
            case CREATE_FOLDER -> checkCreateFolder(i, (CreateFolder) op);
            case ADD_TO_VIEW -> {
                AddToView add = (AddToView) op;
                yield first(required(i, "viewId", add.viewId()), required(i, "elementId", add.elementId()),
                        positive(i, "width", add.width()), positive(i, "height", add.height()));
            }
            case ADD_CONNECTION_TO_VIEW -> checkAddConnection(i, (AddConnectionToView) op);
            case NEST_IN_VIEW -> {
                NestInView nest = (NestInView) op;
                EngineError error = first(required(i, "viewId", nest.viewId()),
                        required(i, "visualId", nest.visualId()),
                        required(i, "parentVisualId", nest.parentVisualId()));
                if (error == null && nest.visualId().equals(nest.parentVisualId())) {
                    error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, "parentVisualId",
                            "A view object cannot be nested in itself");
                }
                yield error;
            }
            case STYLE_VIEW_OBJECT -> checkStyleViewObject(i, (StyleViewObject) op);
            case STYLE_CONNECTION -> checkStyleConnection(i, (StyleConnection) op);
            case MOVE_VIEW_OBJECT -> {
                MoveViewObject move = (MoveViewObject) op;
                EngineError error = first(required(i, "viewObjectId", move.viewObjectId()),
                        positive(i, "width", move.width()), positive(i, "height", move.height()));
                if (error == null && move.x() == null && move.y() == null && move.width() == null
                        && move.height() == null) {
                    error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, null,
                            "moveViewObject needs at least one of x, y, width or height");
                }
                yield error;
            }
            case CREATE_NOTE -> {
                CreateNote note = (CreateNote) op;
                EngineError error = first(required(i, "viewId", note.viewId()),
                        positive(i, "width", note.width()), positive(i, "height", note.height()));
                if (error == null && note.content() == null) {
                    error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, "content", "content is required");
                }
                yield error;
            }
            case CREATE_GROUP -> {
                CreateGroup group = (CreateGroup) op;
                yield first(required(i, "viewId", group.viewId()), required(i, "name", group.name()),
                        positive(i, "width", group.width()), positive(i, "height", group.height()));
            }
            case CREATE_VIEW -> {
                CreateView view = (CreateView) op;
                EngineError error = required(i, "name", view.name());
                if (error == null && view.viewpoint() != null
                        && (view.viewpoint().isBlank() || view.viewpoint().contains("@"))) {
                    error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, "viewpoint",
                            "viewpoint must be a non-empty viewpoint id without '@'");
                }
                yield error;
            }
            case DELETE_VIEW -> required(i, "viewId", ((Operation.DeleteView) op).viewId());
            case DELETE_CONNECTION_FROM_VIEW -> {
                Operation.DeleteConnectionFromView delete = (Operation.DeleteConnectionFromView) op;
                yield first(required(i, "viewId", delete.viewId()),
                        required(i, "connectionId", delete.connectionId()));
            }
        };
    }

    private EngineError checkCreateElement(int i, CreateElement op) {
        return first(elementType(i, "type", op.type()), required(i, "name", op.name()),
                properties(i, "properties", op.properties()));
    }

    private EngineError checkCreateRelationship(int i, CreateRelationship op) {
        return first(relationshipType(i, "type", op.type()), required(i, "sourceId", op.sourceId()),
                required(i, "targetId", op.targetId()), accessType(i, "accessType", op.accessType()),
                properties(i, "properties", op.properties()));
    }

    private EngineError checkCreateOrGetElement(int i, CreateOrGetElement op) {
        if (op.create() == null) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, "create", "create is required");
        }
        EngineError error = first(elementType(i, "create.type", op.create().type()),
                required(i, "create.name", op.create().name()),
                properties(i, "create.properties", op.create().properties()));
        if (error == null && op.match() != null && op.match().type() != null
                && !op.match().type().equals(op.create().type())) {
            error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, "match.type",
                    "match.type must equal create.type")
                    .withHint("A match on a different type could never be reused as the created element");
        }
        return error;
    }

    private EngineError checkCreateOrGetRelationship(int i, CreateOrGetRelationship op) {
        if (op.create() == null) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, "create", "create is required");
        }
        EngineError error = first(relationshipType(i, "create.type", op.create().type()),
                required(i, "create.sourceId", op.create().sourceId()),
                required(i, "create.targetId", op.create().targetId()),
                accessType(i, "create.accessType", op.create().accessType()),
                properties(i, "create.properties", op.create().properties()));
        if (error == null && op.match() != null) {
            error = accessType(i, "match.accessType", op.match().accessType());
        }
        return error;
    }

    private EngineError checkUpdate(int i, String id, String name, String documentation,
            Map<String, String> properties) {
        EngineError error = first(required(i, "id", id), properties(i, "properties", properties));
        if (error == null && name == null && documentation == null && (properties == null || properties.isEmpty())) {
            error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, null,
                    "Update needs at least one of name, documentation or properties");
        }
        return error;
    }

    private EngineError checkCreateFolder(int i, CreateFolder op) {
        EngineError error = required(i, "name", op.name());
        if (error != null) {
            return error;
        }
        if (op.parentId() == null && op.parentType() == null && op.parentFolder() == null) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, null,
                    "createFolder needs one of parentId, parentType or parentFolder");
        }
        if (op.parentType() != null && FolderType.parse(op.parentType()).isEmpty()) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, "parentType",
                    "Unknown folder type '" + op.parentType() + "'");
        }
        if (op.parentFolder() != null && model.findFolderByName(op.parentFolder()).isEmpty()) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, "parentFolder",
                    "No folder named '" + op.parentFolder() + "'").withReference(op.parentFolder());
        }
        return null;
    }

    private EngineError checkAddConnection(int i, AddConnectionToView op) {
        EngineError error = first(required(i, "viewId", op.viewId()),
                required(i, "relationshipId", op.relationshipId()));
        if (error != null) {
            return error;
        }
        boolean hasSource = op.sourceVisualId() != null;
        boolean hasTarget = op.targetVisualId() != null;
        if (hasSource != hasTarget) {
            String missing = hasSource ? "targetVisualId" : "sourceVisualId";
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, missing,
                    "sourceVisualId and targetVisualId must be given together");
        }
        if (!hasSource && !op.resolveVisuals()) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, "sourceVisualId",
                    "Visual endpoints are required unless autoResolveVisuals is true");
        }
        return null;
    }

    private EngineError checkStyleViewObject(int i, StyleViewObject op) {
        EngineError error = first(required(i, "viewObjectId", op.viewObjectId()),
                color(i, "fillColor", op.fillColor()), color(i, "lineColor", op.lineColor()),
                color(i, "fontColor", op.fontColor()), range(i, "opacity", op.opacity(), 0, 255),
                range(i, "lineWidth", op.lineWidth(), 1, 10));
        if (error == null && op.fillColor() == null && op.lineColor() == null && op.fontColor() == null
                && op.font() == null && op.opacity() == null && op.lineWidth() == null) {
            error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, null,
                    "styleViewObject needs at least one style attribute");
        }
        return error;
    }

    private EngineError checkStyleConnection(int i, StyleConnection op) {
        EngineError error = first(required(i, "connectionId", op.connectionId()),
                color(i, "lineColor", op.lineColor()), color(i, "fontColor", op.fontColor()),
                range(i, "lineWidth", op.lineWidth(), 1, 10), range(i, "textPosition", op.textPosition(), 0, 2));
        if (error == null && op.lineColor() == null && op.fontColor() == null && op.font() == null
                && op.lineWidth() == null && op.textPosition() == null) {
            error = EngineError.at(ErrorCode.VALIDATION_ERROR, i, null,
                    "styleConnection needs at least one style attribute");
        }
        return error;
    }

    private static EngineError first(EngineError... candidates) {
        for (EngineError candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static EngineError required(int i, String field, String value) {
        if (value == null || value.isBlank()) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, field + " is required");
        }
        return null;
    }

    private static EngineError elementType(int i, String field, String type) {
        EngineError missing = required(i, field, type);
        if (missing != null) {
            return missing;
        }
        if (!ArchimateTypes.isElementType(type)) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, "Unknown element type '" + type + "'")
                    .withHint("Element types are kebab-case, e.g. business-actor or application-component");
        }
        return null;
    }

    private static EngineError relationshipType(int i, String field, String type) {
        EngineError missing = required(i, field, type);
        if (missing != null) {
            return missing;
        }
        if (!ArchimateTypes.isRelationshipType(type)) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, "Unknown relationship type '" + type + "'")
                    .withHint("Relationship types are kebab-case, e.g. serving-relationship");
        }
        return null;
    }

    private static EngineError accessType(int i, String field, String value) {
        if (value != null && !ACCESS_TYPES.contains(value)) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field,
                    "accessType must be one of " + ACCESS_TYPES.stream().sorted().toList());
        }
        return null;
    }

    private static EngineError properties(int i, String field, Map<String, String> properties) {
        if (properties == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, "Property keys must not be blank");
            }
            if (entry.getValue() == null) {
                return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field + "." + entry.getKey(),
                        "Property values must be strings");
            }
        }
        return null;
    }

    private static EngineError color(int i, String field, String value) {
        if (value != null && !HEX_COLOR.matcher(value).matches()) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, field + " must be a #RRGGBB color")
                    .withReference(value);
        }
        return null;
    }

    private static EngineError range(int i, String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field,
                    field + " must be between " + min + " and " + max + ", got " + value);
        }
        return null;
    }

    private static EngineError positive(int i, String field, Integer value) {
        if (value != null && value <= 0) {
            return EngineError.at(ErrorCode.VALIDATION_ERROR, i, field, field + " must be positive, got " + value);
        }
        return null;
    }
}
