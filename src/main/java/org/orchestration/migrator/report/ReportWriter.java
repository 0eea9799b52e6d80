package org.orchestration.migrator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.orchestration.migrator.analysis.models.AnalysisResult;
import org.orchestration.migrator.analysis.models.GapAnalysisReport;
import org.orchestration.migrator.analyzerConfig.models.AnalyzerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a {@link GapAnalysisReport} as JSON and as a plain-text summary.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String TEXT_TEMPLATE = "gap-report.ftl";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static void saveJson(GapAnalysisReport report, Path target) throws IOException {
        createParent(target);
        mapper.writeValue(target.toFile(), report);
        log.info("JSON report saved to {}", target);
    }

    public static void saveText(GapAnalysisReport report, AnalyzerConfig config, Path target) throws IOException {
        createParent(target);
        Files.writeString(target, renderText(report, config), StandardCharsets.UTF_8);
        log.info("Text report saved to {}", target);
    }

    /**
     * Renders the text summary with the bundled FreeMarker template.
     *
     * @throws IOException if the template cannot be loaded or fails to render
     */
    public static String renderText(GapAnalysisReport report, AnalyzerConfig config) throws IOException {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setClassLoaderForTemplateLoading(ReportWriter.class.getClassLoader(), "templates");

        Template template = cfg.getTemplate(TEXT_TEMPLATE);
        try (StringWriter out = new StringWriter()) {
            template.process(textModel(report, config), out);
            return out.toString();
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEXT_TEMPLATE + ": " + e.getMessage(), e);
        }
    }

    // the template only sees maps, lists, strings and numbers
    static Map<String, Object> textModel(GapAnalysisReport report, AnalyzerConfig config) {
        Map<String, Object> model = new HashMap<>();
        model.put("directory", report.directory == null ? "" : report.directory);
        model.put("totalFiles", report.totalFilesAnalyzed);
        model.put("parsed", report.successfullyParsed);
        model.put("failed", report.failedToParse);
        model.put("cancelled", report.cancelled);
        model.put("successRate", String.format(Locale.ROOT, "%.1f", report.successRate()));

        Map<String, Integer> patterns = new LinkedHashMap<>();
        patterns.put("Correlation sets", report.filesWithCorrelation.size());
        patterns.put("Convoy", report.filesWithConvoy.size());
        patterns.put("Aggregator", report.filesWithAggregator.size());
        patterns.put("Content-based routing", report.filesWithContentBasedRouting.size());
        patterns.put("Scatter-gather", report.filesWithScatterGather.size());
        patterns.put("Message broker", report.filesWithMessageBroker.size());
        patterns.put("Dynamic ports", report.filesWithDynamicPorts.size());
        patterns.put("Transactions", report.filesWithTransactions.size());
        patterns.put("Business rules", report.filesWithBusinessRules.size());
        patterns.put("Compensation", report.filesWithCompensation.size());
        model.put("patterns", entries(patterns));

        List<Map.Entry<String, Integer>> topShapes = new ArrayList<>(report.shapeTypeFrequency.entrySet());
        topShapes.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        model.put("topShapes", entries(topShapes.subList(0, Math.min(config.topShapeTypes, topShapes.size()))));

        List<Map<String, Object>> unsupported = new ArrayList<>();
        report.unsupportedShapeFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> {
                    Map<String, Object> row = new HashMap<>();
                    row.put("name", e.getKey());
                    row.put("count", e.getValue());
                    row.put("examples", String.join(", ", report.unsupportedShapeExamples.getOrDefault(e.getKey(), List.of())));
                    unsupported.add(row);
                });
        model.put("unsupportedShapes", unsupported);
        model.put("recommendations", report.recommendedFeatures);

        Map<String, Integer> complexity = complexityBuckets(report, config);
        model.put("complexity", entries(complexity));
        return model;
    }

    /**
     * Buckets the parsed files by number of distinct shape types.
     */
    public static Map<String, Integer> complexityBuckets(GapAnalysisReport report, AnalyzerConfig config) {
        int simple = 0;
        int medium = 0;
        int complex = 0;
        for (AnalysisResult result : report.fileDetails) {
            if (!result.parsedSuccessfully()) {
                continue;
            }
            int distinct = result.shapeTypes().size();
            if (distinct >= config.complexShapeTypeThreshold) {
                complex++;
            } else if (distinct >= config.mediumShapeTypeThreshold) {
                medium++;
            } else {
                simple++;
            }
        }
        Map<String, Integer> buckets = new LinkedHashMap<>();
        buckets.put(String.format("Simple (< %d shape types)", config.mediumShapeTypeThreshold), simple);
        buckets.put(String.format("Medium (%d-%d shape types)", config.mediumShapeTypeThreshold,
                config.complexShapeTypeThreshold - 1), medium);
        buckets.put(String.format("Complex (>= %d shape types)", config.complexShapeTypeThreshold), complex);
        return buckets;
    }

    private static List<Map<String, Object>> entries(Map<String, Integer> values) {
        return entries(new ArrayList<>(values.entrySet()));
    }

    private static List<Map<String, Object>> entries(List<Map.Entry<String, Integer>> values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : values) {
            Map<String, Object> row = new HashMap<>();
            row.put("name", entry.getKey());
            row.put("count", entry.getValue());
            rows.add(row);
        }
        return rows;
    }

    private static void createParent(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
