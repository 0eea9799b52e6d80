package org.orchestration.migrator.analysis.models;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of analyzing one orchestration file. When {@code parsedSuccessfully} is false
 * only the file fields and {@code parseError} are meaningful.
 */
@Builder
public record AnalysisResult(
        String fileName,
        long fileSizeBytes,
        boolean parsedSuccessfully,
        String parseError,
        String orchestrationName,

        Map<String, Integer> shapeTypeCounts,  // shape type -> occurrences, first-seen order
        List<String> shapeTypes,
        List<String> unsupportedShapes,
        List<String> partiallySupportedShapes,
        List<String> warnings,

        // feature flags
        boolean hasCorrelationSets,
        boolean hasDynamicPorts,
        boolean hasTransactions,
        boolean hasExceptionHandling,
        boolean hasBusinessRules,
        boolean hasCompensation,
        boolean hasLoops,
        boolean hasParallel,
        boolean hasListen,
        boolean hasDelay,
        boolean hasCallOrchestration,
        boolean hasTransform,
        boolean hasConvoy,
        boolean hasSolicitResponse,

        // integration patterns
        boolean hasAggregatorPattern,
        boolean hasContentBasedRouting,
        boolean hasScatterGather,
        boolean hasMessageBroker,

        int portCount,
        int messageCount,
        int correlationSetCount
) {
    public AnalysisResult {
        shapeTypeCounts = shapeTypeCounts == null ? new LinkedHashMap<>() : shapeTypeCounts;
        shapeTypes = shapeTypes == null ? List.of() : shapeTypes;
        unsupportedShapes = unsupportedShapes == null ? List.of() : unsupportedShapes;
        partiallySupportedShapes = partiallySupportedShapes == null ? List.of() : partiallySupportedShapes;
        warnings = warnings == null ? List.of() : warnings;
        parseError = parseError == null ? "" : parseError;
        orchestrationName = orchestrationName == null ? "" : orchestrationName;
    }

    public static AnalysisResult failed(String fileName, long fileSizeBytes, String error) {
        return AnalysisResult.builder()
                .fileName(fileName)
                .fileSizeBytes(fileSizeBytes)
                .parsedSuccessfully(false)
                .parseError(error)
                .build();
    }
}
