package com.nayem.tessera.validate;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.model.InMemoryModelSubstrate;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.DuplicateStrategy;
import com.nayem.tessera.operation.ExecutionGranularity;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.support.ModelFixture;
import com.nayem.tessera.tempid.MappingKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.nayem.tessera.support.Ops.addToView;
import static com.nayem.tessera.support.Ops.connect;
import static com.nayem.tessera.support.Ops.createElement;
import static com.nayem.tessera.support.Ops.createRelationship;
import static com.nayem.tessera.support.Ops.createView;
import static org.assertj.core.api.Assertions.assertThat;

class BatchValidatorTest {

    private InMemoryModelSubstrate substrate;
    private ModelFixture model;
    private BatchValidator validator;

    @BeforeEach
    void setUp() {
        substrate = new InMemoryModelSubstrate();
        model = new ModelFixture(substrate);
        validator = new BatchValidator(substrate);
    }

    @Test
    void acceptsForwardTempIdReferencesAndRegistersEveryTempId() {
        Batch batch = Batch.of(List.of(
                createElement("a", "business-actor", "Customer"),
                createElement("b", "business-role", "Buyer"),
                createRelationship("r", "assignment-relationship", "a", "b"),
                createView("v", "Overview"),
                addToView("va", "v", "a")));

        Result<ValidatedBatch> result = validator.validate(batch);

        assertThat(result.isOk()).isTrue();
        ValidatedBatch validated = result.value();
        assertThat(validated.tempIds().size()).isEqualTo(5);
        assertThat(validated.tempIds().lookup("r").orElseThrow().kind()).isEqualTo(MappingKind.CONCEPT);
        assertThat(validated.tempIds().lookup("va").orElseThrow().kind()).isEqualTo(MappingKind.VISUAL);
        assertThat(validated.granularity()).isEqualTo(ExecutionGranularity.PER_BATCH_CHUNKING);
        assertThat(validated.strategies()).containsOnly(DuplicateStrategy.ERROR);
    }

    @Test
    void rejectsEmptyBatch() {
        Result<ValidatedBatch> result = validator.validate(Batch.of(List.of()));

        assertThat(result.isOk()).isFalse();
        assertThat(result.error().code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(result.error().path()).isEqualTo("/changes");
    }

    @Test
    void rejectsBatchAboveConfiguredMaximum() {
        BatchValidator small = new BatchValidator(substrate, 2, ExecutionGranularity.PER_BATCH_CHUNKING);
        List<Operation> ops = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            ops.add(createElement(null, "business-actor", "Actor " + i));
        }

        Result<ValidatedBatch> result = small.validate(Batch.of(ops));

        assertThat(result.isOk()).isFalse();
        assertThat(result.error().message()).contains("maximum is 2");
    }

    @Test
    void referenceToLaterTempIdIsUnresolved() {
        Batch batch = Batch.of(List.of(
                createRelationship("r", "serving-relationship", "a", "b"),
                createElement("a", "application-service", "Billing"),
                createElement("b", "business-process", "Invoice")));

        EngineError error = validator.validate(batch).error();

        assertThat(error.code()).isEqualTo(ErrorCode.UNRESOLVED_TEMP_ID);
        assertThat(error.opIndex()).isEqualTo(0);
        assertThat(error.field()).isEqualTo("sourceId");
        assertThat(error.path()).isEqualTo("/changes/0/sourceId");
        assertThat(error.hint()).contains("defined by operation 1");
    }

    @Test
    void operationReferencingItsOwnTempIdIsUnresolved() {
        Batch batch = Batch.of(List.of(
                createElement("a", "business-actor", "Customer"),
                createRelationship("r", "association-relationship", "r", "a")));

        EngineError error = validator.validate(batch).error();

        assertThat(error.code()).isEqualTo(ErrorCode.UNRESOLVED_TEMP_ID);
        assertThat(error.opIndex()).isEqualTo(1);
        assertThat(error.field()).isEqualTo("sourceId");
        assertThat(error.reference()).isEqualTo("r");
        assertThat(error.hint()).isEqualTo("An operation cannot reference its own tempId");
    }

    @Test
    void unknownIdIsUnresolved() {
        Batch batch = Batch.of(List.of(new Operation.DeleteElement("id-nope", null)));

        EngineError error = validator.validate(batch).error();

        assertThat(error.code()).isEqualTo(ErrorCode.UNRESOLVED_TEMP_ID);
        assertThat(error.reference()).isEqualTo("id-nope");
    }

    @Test
    void existingIdsResolveAgainstTheModel() {
        String actor = model.element("business-actor", "Customer");
        String role = model.element("business-role", "Buyer");

        Batch batch = Batch.of(List.of(createRelationship(null, "assignment-relationship", actor, role)));

        assertThat(validator.validate(batch).isOk()).isTrue();
    }

    @Test
    void duplicateTempIdIsRejected() {
        Batch batch = Batch.of(List.of(
                createElement("a", "business-actor", "Customer"),
                createElement("a", "business-actor", "Supplier")));

        EngineError error = validator.validate(batch).error();

        assertThat(error.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(error.opIndex()).isEqualTo(1);
        assertThat(error.message()).contains("already defined by operation 0");
    }

    @Test
    void tempIdOfWrongKindIsRejected() {
        Batch batch = Batch.of(List.of(
                createElement("a", "business-actor", "Customer"),
                addToView(null, "a", "a")));

        EngineError error = validator.validate(batch).error();

        assertThat(error.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(error.field()).isEqualTo("viewId");
    }

    @Test
    void unknownElementTypeIsRejected() {
        EngineError error = validator.validate(Batch.of(List.of(
                createElement("a", "business-wizard", "Merlin")))).error();

        assertThat(error.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(error.field()).isEqualTo("type");
    }

    @Test
    void connectionNeedsBothVisualsOrAutoResolve() {
        String view = model.view("Main");
        String a = model.element("business-actor", "A");
        String b = model.element("business-role", "B");
        String rel = model.relationship("assignment-relationship", a, b);
        String va = model.visual(view, a);

        EngineError oneSided = validator.validate(Batch.of(List.of(connect(null, view, rel, va, null)))).error();
        EngineError neither = validator.validate(Batch.of(List.of(connect(null, view, rel, null, null)))).error();

        assertThat(oneSided.field()).isEqualTo("targetVisualId");
        assertThat(neither.message()).contains("autoResolveVisuals");
    }

    @Test
    void renameIsNotAllowedForCreateOrGetRelationship() {
        String a = model.element("business-actor", "A");
        String b = model.element("business-role", "B");
        Operation op = new Operation.CreateOrGetRelationship(null,
                new Operation.RelationshipSpec("assignment-relationship", a, b, null, null, null, null, null),
                null, DuplicateStrategy.RENAME);

        EngineError error = validator.validate(Batch.of(List.of(op))).error();

        assertThat(error.field()).isEqualTo("onDuplicate");
    }

    @Test
    void operationStrategyOverridesBatchDefault() {
        Batch batch = Batch.of(List.of(
                createElement(null, "business-actor", "A"),
                createElement(null, "business-actor", "B", DuplicateStrategy.RENAME)))
                .withDuplicateStrategy(DuplicateStrategy.REUSE);

        ValidatedBatch validated = validator.validate(batch).value();

        assertThat(validated.strategy(0)).isEqualTo(DuplicateStrategy.REUSE);
        assertThat(validated.strategy(1)).isEqualTo(DuplicateStrategy.RENAME);
    }

    @Test
    void malformedIdempotencyKeyIsRejected() {
        assertThat(BatchValidator.checkIdempotencyKey("ok:key_1-2")).isEmpty();
        assertThat(BatchValidator.checkIdempotencyKey("has space")).isPresent();
        assertThat(BatchValidator.checkIdempotencyKey("x".repeat(129))).isPresent();
    }
}
