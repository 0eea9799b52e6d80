package org.orchestration.migrator.analyzerConfig.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Settings of a gap analysis run. Every field has a default, so a config file
 * only needs to list what it changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {
    /**
     * Extension of the orchestration files to scan, compared case-insensitively.
     */
    public String sourceFileExtension = ".odx";

    public boolean includeSubdirectories = false;

    /**
     * How many example file names are kept per unsupported shape type.
     */
    public int maxUnsupportedExamples = 3;

    /**
     * Distinct shape type counts from which an orchestration is reported as medium / complex.
     */
    public int mediumShapeTypeThreshold = 5;
    public int complexShapeTypeThreshold = 10;

    public int topShapeTypes = 20;

    public String jsonReportFileName = "gap-analysis-report.json";
    public String textReportFileName = "gap-analysis-report.txt";

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }
}
