package com.nayem.tessera.compile;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.Operation.AddConnectionToView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconciles the visual endpoints of a view connection with the direction of
 * the relationship it draws.
 * <p>
 * Endpoint concepts are compared as {@link ObjectRef}s, so a relationship
 * created earlier in the batch is checked against the endpoints it will have
 * once committed.
 * </p>
 */
public class ConnectionResolver {

    /**
     * Endpoints a connection will be drawn between.
     *
     * @param sourceVisual diagram object at the relationship's source end
     * @param targetVisual diagram object at the relationship's target end
     * @param swapped      whether the client's endpoints were reversed to match
     * @param autoResolved whether the endpoints were found by searching the view
     * @param warnings     notes to attach to the result
     */
    public record Endpoints(ObjectRef sourceVisual, ObjectRef targetVisual, boolean swapped, boolean autoResolved,
            List<String> warnings) {
    }

    Result<Endpoints> resolve(int opIndex, AddConnectionToView op, ObjectRef view, KnownObject relationship,
            ObjectRef sourceVisual, ObjectRef targetVisual, BatchScope scope) {
        if (sourceVisual == null && targetVisual == null) {
            return autoResolve(opIndex, view, relationship, scope);
        }

        Optional<KnownObject> source = scope.describe(sourceVisual);
        Optional<KnownObject> target = scope.describe(targetVisual);
        if (source.isEmpty()) {
            return Result.err(notFound(opIndex, "sourceVisualId", op.sourceVisualId()));
        }
        if (target.isEmpty()) {
            return Result.err(notFound(opIndex, "targetVisualId", op.targetVisualId()));
        }
        ObjectRef sourceConcept = source.get().concept();
        ObjectRef targetConcept = target.get().concept();

        if (relationship.source().equals(sourceConcept) && relationship.target().equals(targetConcept)) {
            return Result.ok(new Endpoints(sourceVisual, targetVisual, false, false, List.of()));
        }

        boolean reversed = relationship.target().equals(sourceConcept)
                && relationship.source().equals(targetConcept);
        if (reversed && op.swapAllowed()) {
            String warning = "Swapped sourceVisualId and targetVisualId to follow the relationship direction ("
                    + op.targetVisualId() + " -> " + op.sourceVisualId() + ")";
            return Result.ok(new Endpoints(targetVisual, sourceVisual, true, false, List.of(warning)));
        }

        EngineError error = EngineError.at(ErrorCode.DIRECTION_MISMATCH, opIndex, "sourceVisualId",
                reversed ? "Visual endpoints are reversed relative to relationship " + op.relationshipId()
                        : "Visual endpoints do not reference the source and target of relationship "
                                + op.relationshipId())
                .withReference(op.sourceVisualId())
                .withHint(reversed ? "Swap sourceVisualId and targetVisualId, or set autoSwapDirection to true"
                        : "Use visuals of the relationship's source and target elements, "
                                + "or omit them and set autoResolveVisuals to true");
        return Result.err(error);
    }

    private Result<Endpoints> autoResolve(int opIndex, ObjectRef view, KnownObject relationship, BatchScope scope) {
        List<KnownObject> sources = scope.visualsFor(view, relationship.source());
        List<KnownObject> targets = scope.visualsFor(view, relationship.target());
        if (sources.size() != 1 || targets.size() != 1) {
            List<String> problems = new ArrayList<>();
            if (sources.size() != 1) {
                problems.add(sources.size() + " candidate(s) for the source end");
            }
            if (targets.size() != 1) {
                problems.add(targets.size() + " candidate(s) for the target end");
            }
            return Result.err(EngineError.at(ErrorCode.AMBIGUOUS_VISUAL_RESOLUTION, opIndex, "sourceVisualId",
                    "Cannot pick visual endpoints automatically: " + String.join(", ", problems))
                    .withHint(sources.isEmpty() || targets.isEmpty()
                            ? "Add the missing element to the view first"
                            : "Pass sourceVisualId and targetVisualId explicitly"));
        }
        return Result.ok(new Endpoints(sources.get(0).ref(), targets.get(0).ref(), false, true, List.of()));
    }

    private static EngineError notFound(int opIndex, String field, String value) {
        return EngineError.at(ErrorCode.REFERENCE_NOT_FOUND, opIndex, field, "View object '" + value + "' not found")
                .withReference(value);
    }
}
