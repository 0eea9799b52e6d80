package org.orchestration.migrator.analysis.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a directory scan. Filled by a single thread while files are analyzed.
 */
public class GapAnalysisReport {
    public String directory;
    public int totalFilesAnalyzed;
    public int successfullyParsed;
    public int failedToParse;
    public boolean cancelled;

    public List<AnalysisResult> fileDetails = new ArrayList<>();

    /**
     * Shape type -> total occurrences across all parsed files.
     */
    public Map<String, Integer> shapeTypeFrequency = new LinkedHashMap<>();

    /**
     * Unsupported shape type -> number of files it appears in.
     */
    public Map<String, Integer> unsupportedShapeFrequency = new LinkedHashMap<>();
    public Map<String, List<String>> unsupportedShapeExamples = new LinkedHashMap<>();

    public List<String> filesWithCorrelation = new ArrayList<>();
    public List<String> filesWithDynamicPorts = new ArrayList<>();
    public List<String> filesWithTransactions = new ArrayList<>();
    public List<String> filesWithBusinessRules = new ArrayList<>();
    public List<String> filesWithCompensation = new ArrayList<>();
    public List<String> filesWithConvoy = new ArrayList<>();
    public List<String> filesWithAggregator = new ArrayList<>();
    public List<String> filesWithContentBasedRouting = new ArrayList<>();
    public List<String> filesWithScatterGather = new ArrayList<>();
    public List<String> filesWithMessageBroker = new ArrayList<>();

    public List<String> recommendedFeatures = new ArrayList<>();

    public double successRate() {
        return totalFilesAnalyzed == 0 ? 0.0 : successfullyParsed * 100.0 / totalFilesAnalyzed;
    }
}
