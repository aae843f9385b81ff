package com.nayem.tessera.compile;

import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.model.InMemoryModelSubstrate;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.Operation.AddConnectionToView;
import com.nayem.tessera.support.ModelFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionResolverTest {

    private final ConnectionResolver resolver = new ConnectionResolver();

    private ModelFixture model;
    private BatchScope scope;
    private String a;
    private String b;
    private String rel;
    private String view;

    @BeforeEach
    void setUp() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        model = new ModelFixture(substrate);
        scope = new BatchScope(substrate);
        a = model.element("application-component", "Orders");
        b = model.element("application-service", "Ordering");
        rel = model.relationship("realization-relationship", a, b);
        view = model.view("Apps");
    }

    private Result<ConnectionResolver.Endpoints> resolve(AddConnectionToView op, String source, String target) {
        KnownObject relationship = scope.describe(ObjectRef.committed(rel)).orElseThrow();
        return resolver.resolve(0, op, ObjectRef.committed(view), relationship,
                source != null ? ObjectRef.committed(source) : null,
                target != null ? ObjectRef.committed(target) : null, scope);
    }

    @Test
    void matchingDirectionIsKept() {
        String va = model.visual(view, a);
        String vb = model.visual(view, b);

        ConnectionResolver.Endpoints endpoints = resolve(op(va, vb, null, null), va, vb).value();

        assertThat(endpoints.swapped()).isFalse();
        assertThat(endpoints.sourceVisual()).isEqualTo(ObjectRef.committed(va));
        assertThat(endpoints.warnings()).isEmpty();
    }

    @Test
    void reversedEndpointsAreSwappedWhenAllowed() {
        String va = model.visual(view, a);
        String vb = model.visual(view, b);

        ConnectionResolver.Endpoints endpoints = resolve(op(vb, va, true, null), vb, va).value();

        assertThat(endpoints.swapped()).isTrue();
        assertThat(endpoints.sourceVisual()).isEqualTo(ObjectRef.committed(va));
        assertThat(endpoints.targetVisual()).isEqualTo(ObjectRef.committed(vb));
        assertThat(endpoints.warnings()).hasSize(1);
    }

    @Test
    void reversedEndpointsAreAMismatchByDefault() {
        String va = model.visual(view, a);
        String vb = model.visual(view, b);

        Result<ConnectionResolver.Endpoints> result = resolve(op(vb, va, null, null), vb, va);

        assertThat(result.error().code()).isEqualTo(ErrorCode.DIRECTION_MISMATCH);
        assertThat(result.error().message()).contains("reversed");
    }

    @Test
    void unrelatedVisualsAreAMismatch() {
        String other = model.element("application-component", "Billing");
        String va = model.visual(view, a);
        String vOther = model.visual(view, other);

        Result<ConnectionResolver.Endpoints> result = resolve(op(va, vOther, true, null), va, vOther);

        assertThat(result.error().code()).isEqualTo(ErrorCode.DIRECTION_MISMATCH);
        assertThat(result.error().message()).contains("do not reference");
    }

    @Test
    void autoResolvePicksTheOnlyCandidates() {
        String va = model.visual(view, a);
        String vb = model.visual(view, b);

        ConnectionResolver.Endpoints endpoints = resolve(op(null, null, null, true), null, null).value();

        assertThat(endpoints.autoResolved()).isTrue();
        assertThat(endpoints.sourceVisual()).isEqualTo(ObjectRef.committed(va));
        assertThat(endpoints.targetVisual()).isEqualTo(ObjectRef.committed(vb));
    }

    @Test
    void autoResolveRefusesToGuess() {
        model.visual(view, a);
        model.visual(view, a);
        model.visual(view, b);

        Result<ConnectionResolver.Endpoints> result = resolve(op(null, null, null, true), null, null);

        assertThat(result.error().code()).isEqualTo(ErrorCode.AMBIGUOUS_VISUAL_RESOLUTION);
        assertThat(result.error().message()).contains("2 candidate(s) for the source end");
    }

    @Test
    void autoResolveReportsMissingVisual() {
        model.visual(view, a);

        Result<ConnectionResolver.Endpoints> result = resolve(op(null, null, null, true), null, null);

        assertThat(result.error().code()).isEqualTo(ErrorCode.AMBIGUOUS_VISUAL_RESOLUTION);
        assertThat(result.error().hint()).contains("Add the missing element");
    }

    private AddConnectionToView op(String source, String target, Boolean swap, Boolean autoResolve) {
        return new AddConnectionToView(null, view, rel, source, target, swap, autoResolve, null);
    }
}
