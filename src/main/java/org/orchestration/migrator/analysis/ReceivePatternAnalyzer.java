package org.orchestration.migrator.analysis;

import org.orchestration.migrator.analysis.models.ReceivePattern;
import org.orchestration.migrator.analysis.models.ReceivePatternAnalysis;
import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Classifies the activating receives of an orchestration. A target workflow has a
 * single trigger, so anything beyond one activating receive needs a specific mapping
 * or cannot be migrated as is.
 */
public class ReceivePatternAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ReceivePatternAnalyzer.class);

    public static ReceivePatternAnalysis analyze(OrchestrationModel model) {
        Objects.requireNonNull(model, "model");
        ShapeTree tree = model.tree();
        List<ShapeNode> receives = model.allShapes().stream()
                .filter(s -> s.is(ShapeKind.RECEIVE))
                .collect(Collectors.toList());
        List<ShapeNode> activating = receives.stream()
                .filter(r -> receive(r).activate())
                .collect(Collectors.toList());

        log.debug("Orchestration {}: {} receives, {} activating", model.fullName(), receives.size(), activating.size());

        if (activating.isEmpty()) {
            return ReceivePatternAnalysis.builder()
                    .pattern(ReceivePattern.CALLABLE)
                    .requiresRequestTrigger(true)
                    .migrationWarnings(List.of("No activating Receive shapes found. "
                            + "The workflow will use a request trigger (callable workflow)."))
                    .build();
        }

        if (activating.size() == 1) {
            ShapeNode primary = activating.get(0);
            if (!receive(primary).initializesCorrelationSets().isEmpty()) {
                List<ShapeNode> following = receives.stream()
                        .filter(r -> !receive(r).activate())
                        .filter(r -> !receive(r).followsCorrelationSets().isEmpty())
                        .collect(Collectors.toList());
                if (!following.isEmpty()) {
                    return ReceivePatternAnalysis.builder()
                            .pattern(ReceivePattern.CONVOY)
                            .primaryReceive(primary)
                            .secondaryReceives(following)
                            .requiresSessionSupport(true)
                            .migrationWarnings(List.of(String.format(
                                    "Convoy pattern detected with %d correlated receive(s). "
                                            + "Requires session-enabled messaging or custom correlation.",
                                    following.size())))
                            .build();
                }
            }
            return ReceivePatternAnalysis.builder()
                    .pattern(ReceivePattern.SINGLE_TRIGGER)
                    .primaryReceive(primary)
                    .build();
        }

        List<ShapeNode> secondary = activating.subList(1, activating.size());

        List<ShapeNode> listens = activating.stream()
                .map(r -> findAncestor(tree, r, ShapeKind.LISTEN))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        if (listens.size() == activating.size() && listens.stream().distinct().count() == 1) {
            return ReceivePatternAnalysis.builder()
                    .pattern(ReceivePattern.LISTEN_FIRST_TO_COMPLETE)
                    .primaryReceive(activating.get(0))
                    .secondaryReceives(secondary)
                    .requiresTimeoutHandling(true)
                    .migrationWarnings(List.of(String.format(
                            "Listen shape with %d activating receives detected. The first receive becomes the trigger, "
                                    + "the others become Switch/timeout actions; 'first to complete cancels the others' "
                                    + "is not supported natively.", activating.size())))
                    .build();
        }

        long inParallel = activating.stream()
                .filter(r -> findAncestor(tree, r, ShapeKind.PARALLEL).isPresent())
                .count();
        if (inParallel == activating.size()) {
            return ReceivePatternAnalysis.builder()
                    .pattern(ReceivePattern.PARALLEL_ALL_MUST_COMPLETE)
                    .primaryReceive(activating.get(0))
                    .secondaryReceives(secondary)
                    .migrationError(String.format("INVALID PATTERN: %d activating Receive shapes in Parallel branches. "
                            + "A workflow can only have ONE trigger. Split into multiple workflows "
                            + "or use correlation-based sequential receives.", activating.size()))
                    .build();
        }

        return ReceivePatternAnalysis.builder()
                .pattern(ReceivePattern.INVALID)
                .primaryReceive(activating.get(0))
                .secondaryReceives(secondary)
                .migrationError(String.format("INVALID PATTERN: %d sequential activating Receive shapes. "
                        + "A workflow can only have ONE trigger. Redesign to use correlation (convoy pattern) "
                        + "or split into multiple workflows.", activating.size()))
                .build();
    }

    /**
     * Walks parent handles up from {@code node} to the nearest ancestor of the given kind.
     */
    public static Optional<ShapeNode> findAncestor(ShapeTree tree, ShapeNode node, ShapeKind kind) {
        Optional<ShapeNode> current = tree.parentOf(node);
        while (current.isPresent()) {
            if (current.get().is(kind)) {
                return current;
            }
            current = tree.parentOf(current.get());
        }
        return Optional.empty();
    }

    private static ShapePayload.Receive receive(ShapeNode node) {
        return node.payload(ShapePayload.Receive.class);
    }
}
