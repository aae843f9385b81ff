package com.nayem.tessera.compile;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.model.Bounds;
import com.nayem.tessera.model.Fields;
import com.nayem.tessera.model.FolderType;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.model.ObjectKind;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.model.Primitive;
import com.nayem.tessera.model.ProvisionalObject;
import com.nayem.tessera.operation.ArchimateTypes;
import com.nayem.tessera.operation.DuplicateStrategy;
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
import com.nayem.tessera.operation.Operation.ElementMatch;
import com.nayem.tessera.operation.Operation.MoveViewObject;
import com.nayem.tessera.operation.Operation.NestInView;
import com.nayem.tessera.operation.Operation.RelationshipMatch;
import com.nayem.tessera.operation.Operation.RelationshipSpec;
import com.nayem.tessera.operation.Operation.StyleConnection;
import com.nayem.tessera.operation.Operation.StyleViewObject;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.tempid.MappingKind;
import com.nayem.tessera.tempid.TempIdEntry;
import com.nayem.tessera.tempid.TempIdTable;
import com.nayem.tessera.validate.ValidatedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns validated operations into substrate primitives.
 * <p>
 * The whole batch is compiled before anything is submitted, against committed
 * state plus what earlier operations will create. Compilation only constructs
 * detached objects; it never changes the model, so a batch that fails here has
 * no side effects.
 * </p>
 * <p>
 * Construction through {@link ModelSubstrate#instantiateConcept} is not a
 * sub-command. Everything else is, including placement in a folder or view.
 * </p>
 */
public class OperationCompiler {

    private static final Logger log = LoggerFactory.getLogger(OperationCompiler.class);

    static final String DIAGRAM_ELEMENT = "element";
    static final String NOTE = "note";
    static final String GROUP = "group";
    static final String CONNECTION = "connection";
    static final String FOLDER = "folder";
    static final String VIEW = "archimate-diagram-model";

    private final ModelSubstrate substrate;
    private final ConnectionResolver connectionResolver;
    private final DuplicateErrorMode duplicateErrorMode;
    private final OperationFailurePolicy failurePolicy;

    public OperationCompiler(ModelSubstrate substrate) {
        this(substrate, new ConnectionResolver(), DuplicateErrorMode.ABORT_BATCH, OperationFailurePolicy.CONTINUE);
    }

    public OperationCompiler(ModelSubstrate substrate, ConnectionResolver connectionResolver,
            DuplicateErrorMode duplicateErrorMode, OperationFailurePolicy failurePolicy) {
        this.substrate = substrate;
        this.connectionResolver = connectionResolver;
        this.duplicateErrorMode = duplicateErrorMode;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Compiles every operation in order. An error means the batch must not run
     * at all; per-operation failures the policy tolerates come back as skipped
     * operations instead.
     */
    public Result<List<CompiledOperation>> compileAll(ValidatedBatch batch) {
        BatchScope scope = new BatchScope(substrate);
        List<CompiledOperation> compiled = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Compilation compilation = new Compilation(i, batch.operation(i), batch.strategy(i), batch.tempIds(),
                    scope);
            Result<CompiledOperation> result = compile(compilation);
            if (!result.isOk()) {
                log.debug("Compilation aborted at operation {}: {}", i, result.error());
                return Result.err(result.error());
            }
            compiled.add(result.value());
        }
        return Result.ok(compiled);
    }

    private Result<CompiledOperation> compile(Compilation c) {
        Operation op = c.op;
        return switch (op.kind()) {
            case CREATE_ELEMENT -> {
                CreateElement create = (CreateElement) op;
                yield createElement(c, create.type(), create.name(), create.documentation(), create.properties(),
                        "folderId", create.folderId(), new ElementMatch(create.type(), create.name()));
            }
            case CREATE_OR_GET_ELEMENT -> {
                CreateOrGetElement create = (CreateOrGetElement) op;
                yield createElement(c, create.create().type(), create.create().name(),
                        create.create().documentation(), create.create().properties(), "create.folderId",
                        create.create().folderId(), create.effectiveMatch());
            }
            case CREATE_RELATIONSHIP -> {
                CreateRelationship create = (CreateRelationship) op;
                RelationshipSpec spec = new RelationshipSpec(create.type(), create.sourceId(), create.targetId(),
                        create.name(), create.documentation(), create.accessType(), create.strength(),
                        create.properties());
                yield createRelationship(c, "", spec,
                        new RelationshipMatch(create.type(), create.sourceId(), create.targetId(), null, null),
                        false);
            }
            case CREATE_OR_GET_RELATIONSHIP -> {
                CreateOrGetRelationship create = (CreateOrGetRelationship) op;
                yield createRelationship(c, "create.", create.create(), create.effectiveMatch(), true);
            }
            case UPDATE_ELEMENT -> {
                Operation.UpdateElement update = (Operation.UpdateElement) op;
                yield update(c, update.id(), update.name(), update.documentation(), update.properties(),
                        ObjectKind.ELEMENT);
            }
            case UPDATE_RELATIONSHIP -> {
                Operation.UpdateRelationship update = (Operation.UpdateRelationship) op;
                yield update(c, update.id(), update.name(), update.documentation(), update.properties(),
                        ObjectKind.RELATIONSHIP);
            }
            case DELETE_ELEMENT -> deleteElement(c, (Operation.DeleteElement) op);
            case DELETE_RELATIONSHIP -> deleteRelationship(c, (Operation.DeleteRelationship) op);
            case SET_PROPERTY -> setProperty(c, (Operation.SetProperty) op);
            case MOVE_TO_FOLDER -> moveToFolder(c, (Operation.MoveToFolder) op);
            case CREATE_FOLDER -> createFolder(c, (CreateFolder) op);
            case ADD_TO_VIEW -> addToView(c, (AddToView) op);
            case ADD_CONNECTION_TO_VIEW -> addConnection(c, (AddConnectionToView) op);
            case NEST_IN_VIEW -> nestInView(c, (NestInView) op);
            case STYLE_VIEW_OBJECT -> styleViewObject(c, (StyleViewObject) op);
            case STYLE_CONNECTION -> styleConnection(c, (StyleConnection) op);
            case MOVE_VIEW_OBJECT -> moveViewObject(c, (MoveViewObject) op);
            case CREATE_NOTE -> createNote(c, (CreateNote) op);
            case CREATE_GROUP -> createGroup(c, (CreateGroup) op);
            case CREATE_VIEW -> createView(c, (CreateView) op);
            case DELETE_VIEW -> deleteView(c, (Operation.DeleteView) op);
            case DELETE_CONNECTION_FROM_VIEW -> deleteConnection(c, (Operation.DeleteConnectionFromView) op);
        };
    }

    private Result<CompiledOperation> createElement(Compilation c, String type, String name, String documentation,
            Map<String, String> properties, String folderField, String folderId, ElementMatch match) {
        List<KnownObject> matches = c.scope.matchElements(match.type(), match.name());
        String plannedName = name;
        OperationStatus status = OperationStatus.CREATED;
        if (!matches.isEmpty()) {
            if (c.strategy == DuplicateStrategy.ERROR) {
                return c.fail(EngineError.at(ErrorCode.DUPLICATE_CONFLICT, c.opIndex, null,
                        "Element '" + match.name() + "' of type " + match.type() + " already exists ("
                                + matches.get(0).ref() + ")")
                        .withReference(match.name())
                        .withHint("Set onDuplicate to 'reuse' to resolve to the existing element, "
                                + "or 'rename' to create a renamed copy"));
            }
            if (c.strategy == DuplicateStrategy.REUSE) {
                if (matches.size() > 1) {
                    return c.fail(ambiguousMatch(c, matches.size(), "element '" + match.name() + "'"));
                }
                return c.reuse(matches.get(0));
            }
            plannedName = uniqueName(c.scope.elementNames(type), name);
            status = OperationStatus.RENAMED;
        }

        Result<ObjectRef> folder = folderId != null ? c.ref(folderField, folderId)
                : c.rootFolder(ArchimateTypes.defaultFolder(type).orElse(FolderType.OTHER));
        if (!folder.isOk()) {
            return c.fail(folder.error());
        }

        ObjectRef element = c.instantiate(ObjectKind.ELEMENT, type);
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.setField(element, Fields.NAME, plannedName));
        if (documentation != null) {
            primitives.add(Primitive.setField(element, Fields.DOCUMENTATION, documentation));
        }
        addProperties(primitives, element, properties);
        primitives.add(Primitive.addToFolder(element, folder.value()));

        c.scope.created(new KnownObject(element, ObjectKind.ELEMENT, type, plannedName, null, null, null, null,
                null, null));
        ResultPlan.Builder plan = ResultPlan.builder(status).subject(element).detail("type", type);
        if (status == OperationStatus.RENAMED) {
            plan.detail("originalName", name)
                    .warning("Renamed to '" + plannedName + "' because '" + name + "' already exists");
        }
        return c.done(primitives, plan);
    }

    private Result<CompiledOperation> createRelationship(Compilation c, String prefix, RelationshipSpec spec,
            RelationshipMatch match, boolean explicitMatch) {
        Result<KnownObject> source = c.object(prefix + "sourceId", spec.sourceId(), ObjectKind.ELEMENT,
                ObjectKind.RELATIONSHIP);
        if (!source.isOk()) {
            return c.fail(source.error());
        }
        Result<KnownObject> target = c.object(prefix + "targetId", spec.targetId(), ObjectKind.ELEMENT,
                ObjectKind.RELATIONSHIP);
        if (!target.isOk()) {
            return c.fail(target.error());
        }

        ObjectRef matchSource = source.value().ref();
        ObjectRef matchTarget = target.value().ref();
        if (explicitMatch && match.sourceId() != null && !match.sourceId().equals(spec.sourceId())) {
            Result<ObjectRef> ref = c.ref("match.sourceId", match.sourceId());
            if (!ref.isOk()) {
                return c.fail(ref.error());
            }
            matchSource = ref.value();
        }
        if (explicitMatch && match.targetId() != null && !match.targetId().equals(spec.targetId())) {
            Result<ObjectRef> ref = c.ref("match.targetId", match.targetId());
            if (!ref.isOk()) {
                return c.fail(ref.error());
            }
            matchTarget = ref.value();
        }

        List<KnownObject> matches = c.scope.matchRelationships(match.type(), matchSource, matchTarget,
                match.accessType(), match.strength());
        List<String> warnings = new ArrayList<>();
        if (!matches.isEmpty()) {
            if (c.strategy == DuplicateStrategy.ERROR) {
                return c.fail(EngineError.at(ErrorCode.DUPLICATE_CONFLICT, c.opIndex, null,
                        "A " + match.type() + " from " + spec.sourceId() + " to " + spec.targetId()
                                + " already exists (" + matches.get(0).ref() + ")")
                        .withHint("Set onDuplicate to 'reuse' to resolve to the existing relationship"));
            }
            if (c.strategy == DuplicateStrategy.REUSE) {
                if (matches.size() > 1) {
                    return c.fail(ambiguousMatch(c, matches.size(), match.type()));
                }
                return c.reuse(matches.get(0));
            }
            warnings.add("Created a parallel " + spec.type() + " although an equivalent one exists");
        }

        Result<ObjectRef> folder = c.rootFolder(FolderType.RELATIONS);
        if (!folder.isOk()) {
            return c.fail(folder.error());
        }

        ObjectRef relationship = c.instantiate(ObjectKind.RELATIONSHIP, spec.type());
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.setField(relationship, Fields.SOURCE, source.value().ref()));
        primitives.add(Primitive.setField(relationship, Fields.TARGET, target.value().ref()));
        if (spec.name() != null) {
            primitives.add(Primitive.setField(relationship, Fields.NAME, spec.name()));
        }
        if (spec.documentation() != null) {
            primitives.add(Primitive.setField(relationship, Fields.DOCUMENTATION, spec.documentation()));
        }
        if (spec.accessType() != null) {
            primitives.add(Primitive.setField(relationship, Fields.ACCESS_TYPE, spec.accessType()));
        }
        if (spec.strength() != null) {
            primitives.add(Primitive.setField(relationship, Fields.STRENGTH, spec.strength()));
        }
        addProperties(primitives, relationship, spec.properties());
        primitives.add(Primitive.addToFolder(relationship, folder.value()));

        c.scope.created(new KnownObject(relationship, ObjectKind.RELATIONSHIP, spec.type(), spec.name(),
                source.value().ref(), target.value().ref(), null, null, spec.accessType(), spec.strength()));
        ResultPlan.Builder plan = ResultPlan.builder(OperationStatus.CREATED)
                .subject(relationship)
                .detail("type", spec.type())
                .detailRef("sourceId", source.value().ref())
                .detailRef("targetId", target.value().ref())
                .warnings(warnings);
        return c.done(primitives, plan);
    }

    private Result<CompiledOperation> update(Compilation c, String id, String name, String documentation,
            Map<String, String> properties, ObjectKind kind) {
        Result<KnownObject> target = c.object("id", id, kind);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef ref = target.value().ref();
        List<Primitive> primitives = new ArrayList<>();
        if (name != null) {
            primitives.add(Primitive.setField(ref, Fields.NAME, name));
        }
        if (documentation != null) {
            primitives.add(Primitive.setField(ref, Fields.DOCUMENTATION, documentation));
        }
        addProperties(primitives, ref, properties);
        return c.done(primitives, ResultPlan.builder(OperationStatus.UPDATED).subject(ref));
    }

    private Result<CompiledOperation> deleteElement(Compilation c, Operation.DeleteElement op) {
        Result<KnownObject> target = c.object("id", op.id(), ObjectKind.ELEMENT);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef element = target.value().ref();
        List<KnownObject> relationships = c.scope.relationshipsAttachedTo(element);
        if (!op.cascading() && !relationships.isEmpty()) {
            return c.fail(EngineError.at(ErrorCode.VALIDATION_ERROR, c.opIndex, "cascade",
                    "Element " + op.id() + " has " + relationships.size() + " relationship(s)")
                    .withHint("Delete the relationships first or set cascade to true"));
        }

        List<Primitive> primitives = new ArrayList<>();
        for (KnownObject relationship : relationships) {
            for (KnownObject connection : c.scope.connectionsFor(null, relationship.ref())) {
                remove(c, primitives, connection.ref());
            }
            remove(c, primitives, relationship.ref());
        }
        if (op.cascading()) {
            for (KnownObject visual : c.scope.visualsReferencing(element)) {
                remove(c, primitives, visual.ref());
            }
        }
        remove(c, primitives, element);
        return c.done(primitives, ResultPlan.builder(OperationStatus.DELETED)
                .subject(element)
                .detail("cascadedRelationships", String.valueOf(relationships.size())));
    }

    private Result<CompiledOperation> deleteRelationship(Compilation c, Operation.DeleteRelationship op) {
        Result<KnownObject> target = c.object("id", op.id(), ObjectKind.RELATIONSHIP);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef relationship = target.value().ref();
        List<Primitive> primitives = new ArrayList<>();
        for (KnownObject connection : c.scope.connectionsFor(null, relationship)) {
            remove(c, primitives, connection.ref());
        }
        remove(c, primitives, relationship);
        return c.done(primitives, ResultPlan.builder(OperationStatus.DELETED).subject(relationship));
    }

    private Result<CompiledOperation> setProperty(Compilation c, Operation.SetProperty op) {
        Result<KnownObject> target = c.object("id", op.id(), ObjectKind.ELEMENT, ObjectKind.RELATIONSHIP,
                ObjectKind.VIEW);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef ref = target.value().ref();
        return c.done(List.of(Primitive.setProperty(ref, op.key(), op.value())),
                ResultPlan.builder(OperationStatus.UPDATED).subject(ref).detail("key", op.key()));
    }

    private Result<CompiledOperation> moveToFolder(Compilation c, Operation.MoveToFolder op) {
        Result<KnownObject> target = c.object("id", op.id(), ObjectKind.ELEMENT, ObjectKind.RELATIONSHIP,
                ObjectKind.VIEW, ObjectKind.FOLDER);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        Result<KnownObject> folder = c.object("folderId", op.folderId(), ObjectKind.FOLDER);
        if (!folder.isOk()) {
            return c.fail(folder.error());
        }
        if (target.value().ref().equals(folder.value().ref())) {
            return c.fail(EngineError.at(ErrorCode.VALIDATION_ERROR, c.opIndex, "folderId",
                    "A folder cannot be moved into itself"));
        }
        ObjectRef ref = target.value().ref();
        return c.done(List.of(Primitive.addToFolder(ref, folder.value().ref())),
                ResultPlan.builder(OperationStatus.MOVED).subject(ref).detailRef("folderId", folder.value().ref()));
    }

    private Result<CompiledOperation> createFolder(Compilation c, CreateFolder op) {
        Result<ObjectRef> parent;
        if (op.parentId() != null) {
            parent = c.ref("parentId", op.parentId());
        } else if (op.parentType() != null) {
            parent = c.rootFolder(FolderType.parse(op.parentType()).orElse(FolderType.OTHER));
        } else {
            parent = c.scope.model().findFolderByName(op.parentFolder())
                    .map(folder -> Result.ok(ObjectRef.committed(folder.id())))
                    .orElseGet(() -> Result.err(EngineError.at(ErrorCode.REFERENCE_NOT_FOUND, c.opIndex,
                            "parentFolder", "No folder named '" + op.parentFolder() + "'")));
        }
        if (!parent.isOk()) {
            return c.fail(parent.error());
        }

        ObjectRef folder = c.instantiate(ObjectKind.FOLDER, FOLDER);
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.setField(folder, Fields.NAME, op.name()));
        if (op.documentation() != null) {
            primitives.add(Primitive.setField(folder, Fields.DOCUMENTATION, op.documentation()));
        }
        primitives.add(Primitive.addToFolder(folder, parent.value()));
        c.scope.created(new KnownObject(folder, ObjectKind.FOLDER, FOLDER, op.name(), null, null, null, null, null,
                null));
        return c.done(primitives, ResultPlan.builder(OperationStatus.CREATED).subject(folder)
                .detailRef("parentId", parent.value()));
    }

    private Result<CompiledOperation> addToView(Compilation c, AddToView op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<KnownObject> element = c.object("elementId", op.elementId(), ObjectKind.ELEMENT);
        if (!element.isOk()) {
            return c.fail(element.error());
        }
        Result<ObjectRef> container = container(c, view.value(), op.parentVisualId());
        if (!container.isOk()) {
            return c.fail(container.error());
        }

        ObjectRef visual = c.instantiate(ObjectKind.DIAGRAM_OBJECT, DIAGRAM_ELEMENT);
        List<Primitive> primitives = List.of(
                Primitive.setField(visual, Fields.CONCEPT, element.value().ref()),
                Primitive.setField(visual, Fields.BOUNDS, Bounds.defaults(op.x(), op.y(), op.width(), op.height())),
                Primitive.addToView(visual, container.value()));
        c.scope.created(new KnownObject(visual, ObjectKind.DIAGRAM_OBJECT, DIAGRAM_ELEMENT, null, null, null,
                element.value().ref(), view.value().ref(), null, null));
        return c.done(primitives, ResultPlan.builder(OperationStatus.ADDED)
                .subject(visual)
                .detailRef("elementId", element.value().ref())
                .detailRef("viewId", view.value().ref()));
    }

    private Result<CompiledOperation> addConnection(Compilation c, AddConnectionToView op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<KnownObject> relationship = c.object("relationshipId", op.relationshipId(), ObjectKind.RELATIONSHIP);
        if (!relationship.isOk()) {
            return c.fail(relationship.error());
        }
        ObjectRef sourceVisual = null;
        ObjectRef targetVisual = null;
        if (op.sourceVisualId() != null) {
            Result<KnownObject> source = c.object("sourceVisualId", op.sourceVisualId(), ObjectKind.DIAGRAM_OBJECT);
            if (!source.isOk()) {
                return c.fail(source.error());
            }
            Result<KnownObject> target = c.object("targetVisualId", op.targetVisualId(), ObjectKind.DIAGRAM_OBJECT);
            if (!target.isOk()) {
                return c.fail(target.error());
            }
            Optional<EngineError> outside = notInView(c, view.value(), "sourceVisualId", op.sourceVisualId(),
                    source.value())
                    .or(() -> notInView(c, view.value(), "targetVisualId", op.targetVisualId(), target.value()));
            if (outside.isPresent()) {
                return c.fail(outside.get());
            }
            sourceVisual = source.value().ref();
            targetVisual = target.value().ref();
        }

        Result<ConnectionResolver.Endpoints> resolved = connectionResolver.resolve(c.opIndex, op,
                view.value().ref(), relationship.value(), sourceVisual, targetVisual, c.scope);
        if (!resolved.isOk()) {
            return c.fail(resolved.error());
        }
        ConnectionResolver.Endpoints endpoints = resolved.value();

        if (op.skipExisting()) {
            Optional<KnownObject> existing = c.scope.connectionsFor(view.value().ref(), relationship.value().ref())
                    .stream()
                    .filter(connection -> endpoints.sourceVisual().equals(connection.source())
                            && endpoints.targetVisual().equals(connection.target()))
                    .findFirst();
            if (existing.isPresent()) {
                return c.skip(ErrorCode.ALREADY_CONNECTED, null, existing.get().ref());
            }
        }

        ObjectRef connection = c.instantiate(ObjectKind.CONNECTION, CONNECTION);
        List<Primitive> primitives = List.of(
                Primitive.setField(connection, Fields.CONCEPT, relationship.value().ref()),
                Primitive.setField(connection, Fields.SOURCE, endpoints.sourceVisual()),
                Primitive.setField(connection, Fields.TARGET, endpoints.targetVisual()),
                Primitive.addToView(connection, view.value().ref()));
        c.scope.created(new KnownObject(connection, ObjectKind.CONNECTION, CONNECTION, null,
                endpoints.sourceVisual(), endpoints.targetVisual(), relationship.value().ref(), view.value().ref(),
                null, null));
        ResultPlan.Builder plan = ResultPlan.builder(OperationStatus.ADDED)
                .subject(connection)
                .detailRef("relationshipId", relationship.value().ref())
                .detailRef("sourceVisualId", endpoints.sourceVisual())
                .detailRef("targetVisualId", endpoints.targetVisual())
                .warnings(endpoints.warnings());
        if (endpoints.swapped()) {
            plan.detail("swapped", "true");
        }
        if (endpoints.autoResolved()) {
            plan.detail("autoResolved", "true");
        }
        return c.done(primitives, plan);
    }

    private Result<CompiledOperation> nestInView(Compilation c, NestInView op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<KnownObject> visual = c.object("visualId", op.visualId(), ObjectKind.DIAGRAM_OBJECT);
        if (!visual.isOk()) {
            return c.fail(visual.error());
        }
        Result<KnownObject> parent = c.object("parentVisualId", op.parentVisualId(), ObjectKind.DIAGRAM_OBJECT);
        if (!parent.isOk()) {
            return c.fail(parent.error());
        }
        ObjectRef ref = visual.value().ref();
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.addToView(ref, parent.value().ref()));
        if (op.x() != null || op.y() != null) {
            primitives.add(Primitive.setField(ref, Fields.BOUNDS, new Bounds(op.x(), op.y(), null, null)));
        }
        return c.done(primitives, ResultPlan.builder(OperationStatus.NESTED)
                .subject(ref)
                .detailRef("parentVisualId", parent.value().ref()));
    }

    private Result<CompiledOperation> styleViewObject(Compilation c, StyleViewObject op) {
        Result<KnownObject> target = c.object("viewObjectId", op.viewObjectId(), ObjectKind.DIAGRAM_OBJECT);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef ref = target.value().ref();
        List<Primitive> primitives = new ArrayList<>();
        style(primitives, ref, Fields.FILL_COLOR, op.fillColor());
        style(primitives, ref, Fields.LINE_COLOR, op.lineColor());
        style(primitives, ref, Fields.FONT_COLOR, op.fontColor());
        style(primitives, ref, Fields.FONT, op.font());
        style(primitives, ref, Fields.OPACITY, op.opacity());
        style(primitives, ref, Fields.LINE_WIDTH, op.lineWidth());
        return c.done(primitives, ResultPlan.builder(OperationStatus.STYLED).subject(ref));
    }

    private Result<CompiledOperation> styleConnection(Compilation c, StyleConnection op) {
        Result<KnownObject> target = c.object("connectionId", op.connectionId(), ObjectKind.CONNECTION);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef ref = target.value().ref();
        List<Primitive> primitives = new ArrayList<>();
        style(primitives, ref, Fields.LINE_COLOR, op.lineColor());
        style(primitives, ref, Fields.FONT_COLOR, op.fontColor());
        style(primitives, ref, Fields.FONT, op.font());
        style(primitives, ref, Fields.LINE_WIDTH, op.lineWidth());
        style(primitives, ref, Fields.TEXT_POSITION, op.textPosition());
        return c.done(primitives, ResultPlan.builder(OperationStatus.STYLED).subject(ref));
    }

    private Result<CompiledOperation> moveViewObject(Compilation c, MoveViewObject op) {
        Result<KnownObject> target = c.object("viewObjectId", op.viewObjectId(), ObjectKind.DIAGRAM_OBJECT);
        if (!target.isOk()) {
            return c.fail(target.error());
        }
        ObjectRef ref = target.value().ref();
        return c.done(
                List.of(Primitive.setField(ref, Fields.BOUNDS, new Bounds(op.x(), op.y(), op.width(), op.height()))),
                ResultPlan.builder(OperationStatus.MOVED).subject(ref));
    }

    private Result<CompiledOperation> createNote(Compilation c, CreateNote op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<ObjectRef> container = container(c, view.value(), op.parentVisualId());
        if (!container.isOk()) {
            return c.fail(container.error());
        }
        ObjectRef note = c.instantiate(ObjectKind.DIAGRAM_OBJECT, NOTE);
        List<Primitive> primitives = List.of(
                Primitive.setField(note, Fields.CONTENT, op.content()),
                Primitive.setField(note, Fields.BOUNDS, Bounds.defaults(op.x(), op.y(),
                        op.width() != null ? op.width() : 185, op.height() != null ? op.height() : 80)),
                Primitive.addToView(note, container.value()));
        c.scope.created(new KnownObject(note, ObjectKind.DIAGRAM_OBJECT, NOTE, null, null, null, null,
                view.value().ref(), null, null));
        return c.done(primitives, ResultPlan.builder(OperationStatus.CREATED).subject(note)
                .detailRef("viewId", view.value().ref()));
    }

    private Result<CompiledOperation> createGroup(Compilation c, CreateGroup op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<ObjectRef> container = container(c, view.value(), op.parentVisualId());
        if (!container.isOk()) {
            return c.fail(container.error());
        }
        ObjectRef group = c.instantiate(ObjectKind.DIAGRAM_OBJECT, GROUP);
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.setField(group, Fields.NAME, op.name()));
        if (op.documentation() != null) {
            primitives.add(Primitive.setField(group, Fields.DOCUMENTATION, op.documentation()));
        }
        primitives.add(Primitive.setField(group, Fields.BOUNDS, Bounds.defaults(op.x(), op.y(),
                op.width() != null ? op.width() : 400, op.height() != null ? op.height() : 140)));
        primitives.add(Primitive.addToView(group, container.value()));
        c.scope.created(new KnownObject(group, ObjectKind.DIAGRAM_OBJECT, GROUP, op.name(), null, null, null,
                view.value().ref(), null, null));
        return c.done(primitives, ResultPlan.builder(OperationStatus.CREATED).subject(group)
                .detailRef("viewId", view.value().ref()));
    }

    private Result<CompiledOperation> createView(Compilation c, CreateView op) {
        Result<ObjectRef> folder = op.folderId() != null ? c.ref("folderId", op.folderId())
                : c.rootFolder(FolderType.VIEWS);
        if (!folder.isOk()) {
            return c.fail(folder.error());
        }
        ObjectRef view = c.instantiate(ObjectKind.VIEW, VIEW);
        List<Primitive> primitives = new ArrayList<>();
        primitives.add(Primitive.setField(view, Fields.NAME, op.name()));
        if (op.viewpoint() != null) {
            primitives.add(Primitive.setField(view, Fields.VIEWPOINT, op.viewpoint()));
        }
        if (op.documentation() != null) {
            primitives.add(Primitive.setField(view, Fields.DOCUMENTATION, op.documentation()));
        }
        primitives.add(Primitive.addToFolder(view, folder.value()));
        c.scope.created(new KnownObject(view, ObjectKind.VIEW, VIEW, op.name(), null, null, null, null, null, null));
        return c.done(primitives, ResultPlan.builder(OperationStatus.CREATED).subject(view));
    }

    private Result<CompiledOperation> deleteView(Compilation c, Operation.DeleteView op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        List<Primitive> primitives = new ArrayList<>();
        remove(c, primitives, view.value().ref());
        return c.done(primitives, ResultPlan.builder(OperationStatus.DELETED).subject(view.value().ref()));
    }

    private Result<CompiledOperation> deleteConnection(Compilation c, Operation.DeleteConnectionFromView op) {
        Result<KnownObject> view = c.object("viewId", op.viewId(), ObjectKind.VIEW);
        if (!view.isOk()) {
            return c.fail(view.error());
        }
        Result<KnownObject> connection = c.object("connectionId", op.connectionId(), ObjectKind.CONNECTION);
        if (!connection.isOk()) {
            return c.fail(connection.error());
        }
        if (!view.value().ref().equals(connection.value().view())) {
            return c.fail(EngineError.at(ErrorCode.VALIDATION_ERROR, c.opIndex, "connectionId",
                    "Connection " + op.connectionId() + " is not in view " + op.viewId())
                    .withReference(op.connectionId()));
        }
        List<Primitive> primitives = new ArrayList<>();
        remove(c, primitives, connection.value().ref());
        return c.done(primitives, ResultPlan.builder(OperationStatus.DELETED).subject(connection.value().ref()));
    }

    private Result<ObjectRef> container(Compilation c, KnownObject view, String parentVisualId) {
        if (parentVisualId == null) {
            return Result.ok(view.ref());
        }
        Result<KnownObject> parent = c.object("parentVisualId", parentVisualId, ObjectKind.DIAGRAM_OBJECT);
        if (!parent.isOk()) {
            return Result.err(parent.error());
        }
        if (!view.ref().equals(parent.value().view())) {
            return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, c.opIndex, "parentVisualId",
                    "Parent view object " + parentVisualId + " is not in the target view")
                    .withReference(parentVisualId));
        }
        return Result.ok(parent.value().ref());
    }

    private static Optional<EngineError> notInView(Compilation c, KnownObject view, String field, String id,
            KnownObject visual) {
        if (view.ref().equals(visual.view())) {
            return Optional.empty();
        }
        return Optional.of(EngineError.at(ErrorCode.VALIDATION_ERROR, c.opIndex, field,
                "View object " + id + " is not in the target view")
                .withReference(id)
                .withHint("Use visuals from view " + view.ref() + ", or omit both and set autoResolveVisuals to true"));
    }

    private static void remove(Compilation c, List<Primitive> primitives, ObjectRef ref) {
        if (c.scope.isRemoved(ref)) {
            return;
        }
        primitives.add(Primitive.remove(ref));
        c.scope.removed(ref);
    }

    private static void addProperties(List<Primitive> primitives, ObjectRef target, Map<String, String> properties) {
        if (properties == null) {
            return;
        }
        properties.forEach((key, value) -> primitives.add(Primitive.setProperty(target, key, value)));
    }

    private static void style(List<Primitive> primitives, ObjectRef target, String field, Object value) {
        if (value != null) {
            primitives.add(Primitive.setField(target, field, value));
        }
    }

    static String uniqueName(Set<String> taken, String name) {
        int suffix = 2;
        String candidate = name + " (" + suffix + ")";
        while (taken.contains(candidate)) {
            suffix++;
            candidate = name + " (" + suffix + ")";
        }
        return candidate;
    }

    private static EngineError ambiguousMatch(Compilation c, int count, String what) {
        return EngineError.at(ErrorCode.AMBIGUOUS_MATCH, c.opIndex, null,
                "Found " + count + " matches for " + what + "; reuse needs exactly one")
                .withHint("Narrow the match criteria or reference the intended object by id");
    }

    /**
     * Per-operation compilation state.
     */
    private final class Compilation {
        private final int opIndex;
        private final Operation op;
        private final DuplicateStrategy strategy;
        private final TempIdTable tempIds;
        private final BatchScope scope;

        private Compilation(int opIndex, Operation op, DuplicateStrategy strategy, TempIdTable tempIds,
                BatchScope scope) {
            this.opIndex = opIndex;
            this.op = op;
            this.strategy = strategy;
            this.tempIds = tempIds;
            this.scope = scope;
        }

        ObjectRef instantiate(ObjectKind kind, String type) {
            ProvisionalObject object = substrate.instantiateConcept(kind, type);
            return ObjectRef.provisional(object);
        }

        /**
         * Resolves a field value to a reference: a tempId bound earlier in the
         * batch, or a literal id of a live object.
         */
        Result<ObjectRef> ref(String field, String value) {
            Optional<TempIdEntry> entry = tempIds.lookup(value);
            ObjectRef ref;
            if (entry.isPresent()) {
                if (entry.get().isSkipped()) {
                    return Result.err(EngineError.at(ErrorCode.DEPENDENCY_SKIPPED, opIndex, field,
                            "tempId '" + value + "' belongs to operation " + entry.get().definedAt()
                                    + ", which was skipped")
                            .withReference(value));
                }
                ref = entry.get().ref();
                if (ref == null) {
                    throw new IllegalStateException("tempId '" + value + "' used before it was compiled");
                }
            } else {
                ref = ObjectRef.committed(value);
            }
            if (scope.describe(ref).isEmpty()) {
                return Result.err(EngineError.at(ErrorCode.REFERENCE_NOT_FOUND, opIndex, field,
                        "'" + value + "' does not exist"
                                + (scope.isRemoved(ref) ? " (removed earlier in this batch)" : ""))
                        .withReference(value));
            }
            return Result.ok(ref);
        }

        Result<KnownObject> object(String field, String value, ObjectKind... kinds) {
            Result<ObjectRef> ref = ref(field, value);
            if (!ref.isOk()) {
                return Result.err(ref.error());
            }
            KnownObject object = scope.describe(ref.value()).orElseThrow();
            if (!Arrays.asList(kinds).contains(object.kind())) {
                return Result.err(EngineError.at(ErrorCode.VALIDATION_ERROR, opIndex, field,
                        "'" + value + "' is a " + object.kind().name().toLowerCase() + ", expected "
                                + Arrays.stream(kinds).map(k -> k.name().toLowerCase()).toList())
                        .withReference(value));
            }
            return Result.ok(object);
        }

        Result<ObjectRef> rootFolder(FolderType type) {
            return scope.model().findRootFolder(type)
                    .map(folder -> Result.ok(ObjectRef.committed(folder.id())))
                    .orElseGet(() -> Result.err(EngineError.at(ErrorCode.REFERENCE_NOT_FOUND, opIndex, null,
                            "Model has no " + type.displayName() + " folder")));
        }

        Result<CompiledOperation> done(List<Primitive> primitives, ResultPlan.Builder plan) {
            String tempId = op.tempId();
            if (tempId != null) {
                ObjectRef subject = plan.build().subject();
                tempIds.bind(tempId, subject);
                plan.tempId(tempId, op.kind().creates());
            }
            return Result.ok(new CompiledOperation(opIndex, op, primitives, plan.build()));
        }

        Result<CompiledOperation> reuse(KnownObject existing) {
            ResultPlan.Builder plan = ResultPlan.builder(OperationStatus.REUSED)
                    .subject(existing.ref())
                    .detail("type", existing.type());
            return done(List.of(Primitive.resolvedExisting(existing.ref())), plan);
        }

        Result<CompiledOperation> skip(ErrorCode reason, EngineError error, ObjectRef existing) {
            if (op.tempId() != null) {
                tempIds.markSkipped(op.tempId());
            }
            ResultPlan.Builder plan = ResultPlan.builder(OperationStatus.SKIPPED)
                    .skipped(reason.wireName(), error)
                    .detailRef("existingId", existing);
            if (op.tempId() != null) {
                plan.tempId(op.tempId(), op.kind().creates());
            }
            return Result.ok(new CompiledOperation(opIndex, op, List.of(), plan.build()));
        }

        /**
         * Applies the configured policy to a per-operation failure: either the
         * whole batch aborts, or this operation is skipped.
         */
        Result<CompiledOperation> fail(EngineError error) {
            boolean abort = switch (error.code()) {
                case DUPLICATE_CONFLICT -> duplicateErrorMode == DuplicateErrorMode.ABORT_BATCH;
                case DIRECTION_MISMATCH, AMBIGUOUS_VISUAL_RESOLUTION, AMBIGUOUS_MATCH ->
                    failurePolicy == OperationFailurePolicy.ABORT_BATCH;
                case DEPENDENCY_SKIPPED, ALREADY_CONNECTED -> false;
                default -> true;
            };
            if (abort) {
                return Result.err(error);
            }
            log.debug("Skipping operation {} ({}): {}", opIndex, op.kind().wireName(), error.message());
            return skip(error.code(), error, null);
        }
    }
}
