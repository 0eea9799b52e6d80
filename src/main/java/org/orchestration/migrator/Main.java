package org.orchestration.migrator;

import org.orchestration.migrator.analysis.OdxAnalyzer;
import org.orchestration.migrator.analysis.ReceivePatternAnalyzer;
import org.orchestration.migrator.analysis.ShapeTreeDiagnostics;
import org.orchestration.migrator.analysis.models.GapAnalysisReport;
import org.orchestration.migrator.analysis.models.ReceivePatternAnalysis;
import org.orchestration.migrator.analyzerConfig.AnalyzerConfigHelper;
import org.orchestration.migrator.analyzerConfig.models.AnalyzerConfig;
import org.orchestration.migrator.odx.LoggingParseListener;
import org.orchestration.migrator.odx.OdxHelper;
import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int USAGE_ERROR = 1;
    static final int FAILED = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  analyze <directory> [config.json]   gap analysis of every orchestration in a directory",
            "  parse <file.odx>                    dump the parsed shape hierarchy of one file");

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return USAGE_ERROR;
        }
        switch (args[0]) {
            case "analyze" -> {
                if (args.length < 2 || args.length > 3) {
                    out.println(USAGE);
                    return USAGE_ERROR;
                }
                return analyze(Path.of(args[1]), args.length == 3 ? args[2] : null, out);
            }
            case "parse" -> {
                if (args.length != 2) {
                    out.println(USAGE);
                    return USAGE_ERROR;
                }
                return parse(Path.of(args[1]), out);
            }
            default -> {
                out.println("Unknown command: " + args[0]);
                out.println(USAGE);
                return USAGE_ERROR;
            }
        }
    }

    private static int analyze(Path directory, String configPath, PrintStream out) {
        try {
            AnalyzerConfig config = configPath == null
                    ? AnalyzerConfigHelper.loadDefaultConfig()
                    : AnalyzerConfigHelper.loadConfigFile(configPath);

            GapAnalysisReport report = OdxAnalyzer.analyzeDirectory(directory, config, () -> false);
            ReportWriter.saveJson(report, directory.resolve(config.jsonReportFileName));
            ReportWriter.saveText(report, config, directory.resolve(config.textReportFileName));

            log.info("Analyzed {} files: {} parsed, {} failed ({}%)", report.totalFilesAnalyzed,
                    report.successfullyParsed, report.failedToParse, String.format(Locale.ROOT, "%.1f", report.successRate()));
            report.recommendedFeatures.forEach(out::println);
            return OK;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Gap analysis of {} failed: {}", directory, e.getMessage());
            return FAILED;
        }
    }

    private static int parse(Path odxFile, PrintStream out) {
        try {
            OrchestrationModel model = OdxHelper.parseOdxFile(odxFile, new LoggingParseListener());
            out.print(ShapeTreeDiagnostics.dumpHierarchy(model));
            ShapeTreeDiagnostics.countShapes(model).forEach((type, count) -> out.println(type + ": " + count));

            ReceivePatternAnalysis receives = ReceivePatternAnalyzer.analyze(model);
            out.println("Receive pattern: " + receives.pattern());
            receives.migrationWarnings().forEach(w -> out.println("WARNING: " + w));
            if (!receives.migrationError().isEmpty()) {
                out.println("ERROR: " + receives.migrationError());
            }
            model.warnings().forEach(w -> out.println("WARNING: " + w));
            return OK;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to parse {}: {}", odxFile, e.getMessage());
            return FAILED;
        }
    }
}
