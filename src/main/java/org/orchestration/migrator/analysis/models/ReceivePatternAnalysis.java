package org.orchestration.migrator.analysis.models;

import lombok.Builder;
import org.orchestration.migrator.odx.models.ShapeNode;

import java.util.List;

@Builder
public record ReceivePatternAnalysis(
        ReceivePattern pattern,
        ShapeNode primaryReceive,  // becomes the trigger, null for CALLABLE
        List<ShapeNode> secondaryReceives,
        boolean requiresSessionSupport,
        boolean requiresRequestTrigger,
        boolean requiresTimeoutHandling,
        String migrationError,
        List<String> migrationWarnings
) {
    public ReceivePatternAnalysis {
        secondaryReceives = secondaryReceives == null ? List.of() : List.copyOf(secondaryReceives);
        migrationWarnings = migrationWarnings == null ? List.of() : List.copyOf(migrationWarnings);
        migrationError = migrationError == null ? "" : migrationError;
    }

    public boolean isValid() {
        return pattern != ReceivePattern.INVALID && pattern != ReceivePattern.PARALLEL_ALL_MUST_COMPLETE;
    }

    public int totalReceiveCount() {
        return (primaryReceive != null ? 1 : 0) + secondaryReceives.size();
    }
}
