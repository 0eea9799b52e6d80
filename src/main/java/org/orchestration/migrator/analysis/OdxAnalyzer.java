package org.orchestration.migrator.analysis;

import org.orchestration.migrator.analysis.models.AnalysisResult;
import org.orchestration.migrator.analysis.models.GapAnalysisReport;
import org.orchestration.migrator.analyzerConfig.models.AnalyzerConfig;
import org.orchestration.migrator.odx.OdxHelper;
import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.odx.models.PortDirection;
import org.orchestration.migrator.odx.models.PortModel;
import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Migration gap analysis over parsed orchestrations: shape statistics, unsupported
 * constructs, feature flags and integration-pattern signatures. Never mutates a model.
 */
public class OdxAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(OdxAnalyzer.class);

    /**
     * Shape types the workflow mapper can translate, compared case-insensitively.
     */
    public static final Set<String> SUPPORTED_SHAPES = caseInsensitive(
            "Receive", "Send", "Construct", "Transform", "MessageAssignment", "VariableAssignment",
            "VariableDeclaration", "Expression", "Decide", "If", "Else", "Switch", "Loop", "ForEach",
            "While", "Until", "Parallel", "ParallelBranch", "Listen", "Scope", "Catch", "CatchException",
            "Throw", "Terminate", "Suspend", "Call", "Start", "StartOrchestration", "Task", "Group",
            "Delay", "CorrelationDeclaration", "AtomicTransaction", "LongRunningTransaction",
            "Compensation", "Compensate", "CallRules", "CallPolicy");

    /**
     * Supported shape types whose translation loses semantics and needs manual review.
     */
    public static final Set<String> PARTIALLY_SUPPORTED_SHAPES = caseInsensitive(
            "CallRules", "CallPolicy", "Compensation", "Compensate", "AtomicTransaction", "LongRunningTransaction");

    /**
     * Analyzes an already built model.
     *
     * @param model    the orchestration
     * @param fileName name reported for the orchestration
     * @param fileSize size of the source file in bytes
     * @return the analysis result
     */
    public static AnalysisResult analyzeModel(OrchestrationModel model, String fileName, long fileSize) {
        List<ShapeNode> allShapes = model.allShapes();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ShapeNode shape : allShapes) {
            counts.merge(shape.shapeType(), 1, Integer::sum);
        }

        List<String> unsupported = new ArrayList<>();
        List<String> partial = new ArrayList<>();
        for (String shapeType : counts.keySet()) {
            if (!SUPPORTED_SHAPES.contains(shapeType)) {
                unsupported.add(shapeType);
            } else if (PARTIALLY_SUPPORTED_SHAPES.contains(shapeType)) {
                partial.add(shapeType);
            }
        }

        FeatureFlags flags = new FeatureFlags();
        counts.keySet().forEach(flags::accept);

        int correlationSets = countKind(allShapes, ShapeKind.CORRELATION_DECLARATION);
        long activatingReceives = allShapes.stream()
                .filter(s -> s.is(ShapeKind.RECEIVE))
                .filter(s -> s.payload(ShapePayload.Receive.class).activate())
                .count();
        boolean hasCorrelation = flags.correlation || correlationSets > 0;

        int receives = countType(counts, "Receive");
        int sends = countType(counts, "Send");
        int decides = countType(counts, "Decide") + countType(counts, "If");
        int parallels = countType(counts, "Parallel");
        int constructs = countType(counts, "Construct");
        int transforms = countType(counts, "Transform");

        return AnalysisResult.builder()
                .fileName(fileName)
                .fileSizeBytes(fileSize)
                .parsedSuccessfully(true)
                .orchestrationName(model.fullName())
                .shapeTypeCounts(counts)
                .shapeTypes(new ArrayList<>(counts.keySet()))
                .unsupportedShapes(unsupported)
                .partiallySupportedShapes(partial)
                .warnings(model.warnings())
                .hasCorrelationSets(hasCorrelation)
                .hasDynamicPorts(flags.dynamicPorts)
                .hasTransactions(flags.transactions)
                .hasExceptionHandling(flags.exceptionHandling)
                .hasBusinessRules(flags.businessRules)
                .hasCompensation(flags.compensation)
                .hasLoops(flags.loops)
                .hasParallel(flags.parallel)
                .hasListen(flags.listen)
                .hasDelay(flags.delay)
                .hasCallOrchestration(flags.callOrchestration)
                .hasTransform(flags.transform)
                .hasConvoy(activatingReceives > 1 || correlationSets > 1)
                .hasSolicitResponse(model.ports().stream().map(PortModel::direction).anyMatch(PortDirection::isTwoWay))
                .hasAggregatorPattern(receives >= 2 && hasCorrelation && (constructs > 0 || transforms > 0))
                .hasContentBasedRouting(decides > 0 && sends >= 2)
                .hasScatterGather(parallels > 0 && sends >= 2 && receives >= 2)
                .hasMessageBroker(receives >= 2 && decides > 0 && sends >= 2)
                .portCount(model.ports().size())
                .messageCount(model.messages().size())
                .correlationSetCount(correlationSets)
                .build();
    }

    /**
     * Parses and analyzes one file. Failures are captured in the result, never thrown.
     *
     * @param odxFile the orchestration file
     * @return the analysis result, with {@code parsedSuccessfully == false} on any failure
     */
    public static AnalysisResult analyzeFile(Path odxFile) {
        String fileName = odxFile.getFileName().toString();
        long fileSize = 0;
        try {
            fileSize = Files.size(odxFile);
            OrchestrationModel model = OdxHelper.parseOdxFile(odxFile);
            return analyzeModel(model, fileName, fileSize);
        } catch (IOException e) {
            return AnalysisResult.failed(fileName, fileSize, "Cannot read file: " + failureMessage(e));
        } catch (RuntimeException e) {
            return AnalysisResult.failed(fileName, fileSize, failureMessage(e));
        } catch (StackOverflowError e) {
            return AnalysisResult.failed(fileName, fileSize, "Shape nesting too deep to analyze");
        }
    }

    // some exceptions, NullPointerException among them, may carry no message
    static String failureMessage(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.toString() : message;
    }

    public static GapAnalysisReport analyzeDirectory(Path directory) throws IOException {
        return analyzeDirectory(directory, AnalyzerConfig.defaults(), () -> false);
    }

    /**
     * Analyzes every orchestration file of a directory, sorted by path. A file that
     * fails is recorded and the scan goes on.
     *
     * @param directory       the directory to scan
     * @param config          analyzer settings
     * @param cancelRequested checked before each file; the scan stops when it returns true
     * @return the aggregated report, recommendations included
     * @throws IOException if the directory itself cannot be listed
     */
    public static GapAnalysisReport analyzeDirectory(Path directory, AnalyzerConfig config,
                                                     BooleanSupplier cancelRequested) throws IOException {
        List<Path> files = listSourceFiles(directory, config);
        log.info("Found {} {} files in {}", files.size(), config.sourceFileExtension, directory);

        GapAnalysisReport report = new GapAnalysisReport();
        report.directory = directory.toString();
        report.totalFilesAnalyzed = files.size();

        for (Path file : files) {
            if (cancelRequested.getAsBoolean()) {
                log.warn("Analysis cancelled after {} of {} files", report.fileDetails.size(), files.size());
                report.cancelled = true;
                break;
            }
            AnalysisResult result = analyzeFile(file);
            report.fileDetails.add(result);
            if (result.parsedSuccessfully()) {
                log.info("Analyzed {} ({} shape types)", result.fileName(), result.shapeTypes().size());
                aggregate(report, result, config.maxUnsupportedExamples);
            } else {
                log.warn("Failed to analyze {}: {}", result.fileName(), result.parseError());
                report.failedToParse++;
            }
        }

        generateRecommendations(report);
        return report;
    }

    static void aggregate(GapAnalysisReport report, AnalysisResult result, int maxExamples) {
        String fileName = result.fileName();
        report.successfullyParsed++;
        result.shapeTypeCounts().forEach((type, count) -> report.shapeTypeFrequency.merge(type, count, Integer::sum));

        for (String unsupported : result.unsupportedShapes()) {
            report.unsupportedShapeFrequency.merge(unsupported, 1, Integer::sum);
            List<String> examples = report.unsupportedShapeExamples.computeIfAbsent(unsupported, k -> new ArrayList<>());
            if (examples.size() < maxExamples) {
                examples.add(fileName);
            }
        }

        if (result.hasCorrelationSets()) report.filesWithCorrelation.add(fileName);
        if (result.hasDynamicPorts()) report.filesWithDynamicPorts.add(fileName);
        if (result.hasTransactions()) report.filesWithTransactions.add(fileName);
        if (result.hasBusinessRules()) report.filesWithBusinessRules.add(fileName);
        if (result.hasCompensation()) report.filesWithCompensation.add(fileName);
        if (result.hasConvoy()) report.filesWithConvoy.add(fileName);
        if (result.hasAggregatorPattern()) report.filesWithAggregator.add(fileName);
        if (result.hasContentBasedRouting()) report.filesWithContentBasedRouting.add(fileName);
        if (result.hasScatterGather()) report.filesWithScatterGather.add(fileName);
        if (result.hasMessageBroker()) report.filesWithMessageBroker.add(fileName);
    }

    /**
     * Fills the prioritized recommendation list: P0 critical, P1 high, P2 medium,
     * P3 informational, then one P? entry per unsupported shape type by frequency.
     */
    static void generateRecommendations(GapAnalysisReport report) {
        List<String> recommendations = report.recommendedFeatures;
        recommendations.clear();

        addIfUsed(recommendations, report.filesWithBusinessRules,
                "P0 - Business Rules Engine Support: %d files use CallRules. "
                        + "Implement the rules engine integration in the target workflow.");
        addIfUsed(recommendations, report.filesWithCorrelation,
                "P0 - Advanced Correlation Support: %d files use correlation sets. "
                        + "Map correlation to stateful workflow state management.");
        addIfUsed(recommendations, report.filesWithConvoy,
                "P1 - Convoy Pattern Support: %d files use convoy patterns. "
                        + "Implement sequential/parallel convoy conversion using session-enabled queues.");
        addIfUsed(recommendations, report.filesWithDynamicPorts,
                "P1 - Dynamic Port Support: %d files use dynamic ports. "
                        + "Implement late-binding connector selection using dynamic content.");
        addIfUsed(recommendations, report.filesWithCompensation,
                "P1 - Compensation Logic Support: %d files use compensation. "
                        + "Implement compensating transactions using scope error handlers.");
        addIfUsed(recommendations, report.filesWithTransactions,
                "P2 - Transaction Scope Support: %d files use transactions. "
                        + "Document transaction boundary conversion to scopes with error handling.");
        addIfUsed(recommendations, report.filesWithAggregator,
                "P2 - Aggregator Pattern: %d files implement aggregator pattern. "
                        + "Convert using stateful workflows with session-enabled queues for correlation and aggregation.");
        addIfUsed(recommendations, report.filesWithContentBasedRouting,
                "P2 - Content-Based Routing: %d files use content-based routing. "
                        + "Implement using Switch/Condition actions with expression-based routing logic.");
        addIfUsed(recommendations, report.filesWithScatterGather,
                "P2 - Scatter-Gather Pattern: %d files implement scatter-gather. "
                        + "Convert using parallel branches for fan-out and a Compose action for fan-in.");
        addIfUsed(recommendations, report.filesWithMessageBroker,
                "P2 - Message Broker Pattern: %d files implement message broker. "
                        + "Consider topics with filtered subscriptions for routing.");

        recommendations.add("P3 - Hybrid Deployment Option: Consider a hybrid (Kubernetes) deployment of the "
                + "target workflow runtime if regulations, data residency or latency require on-premises hosting.");

        report.unsupportedShapeFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEach(entry -> recommendations.add(String.format(
                        "P? - Support for '%s' shape: Found in %d files (%s)",
                        entry.getKey(), entry.getValue(),
                        String.join(", ", report.unsupportedShapeExamples.getOrDefault(entry.getKey(), List.of())))));
    }

    static List<Path> listSourceFiles(Path directory, AnalyzerConfig config) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        String extension = config.sourceFileExtension.toLowerCase(Locale.ROOT);
        try (Stream<Path> paths = config.includeSubdirectories ? Files.walk(directory) : Files.list(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void addIfUsed(List<String> recommendations, List<String> files, String format) {
        if (!files.isEmpty()) {
            recommendations.add(String.format(format, files.size()));
        }
    }

    private static int countKind(List<ShapeNode> shapes, ShapeKind kind) {
        return (int) shapes.stream().filter(s -> s.is(kind)).count();
    }

    private static int countType(Map<String, Integer> counts, String shapeType) {
        return counts.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(shapeType))
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    private static Set<String> caseInsensitive(String... values) {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(List.of(values));
        return Collections.unmodifiableSet(set);
    }

    // flags raised by the mere presence of a shape type
    private static class FeatureFlags {
        boolean correlation;
        boolean dynamicPorts;
        boolean transactions;
        boolean exceptionHandling;
        boolean businessRules;
        boolean compensation;
        boolean loops;
        boolean parallel;
        boolean listen;
        boolean delay;
        boolean callOrchestration;
        boolean transform;

        void accept(String shapeType) {
            switch (shapeType.toLowerCase(Locale.ROOT)) {
                case "correlationdeclaration", "initializecorrelation", "followscorrelation" -> correlation = true;
                case "dynamicport" -> dynamicPorts = true;
                case "atomictransaction", "longrunningtransaction" -> transactions = true;
                case "catch", "catchexception" -> exceptionHandling = true;
                case "callrules", "callpolicy" -> businessRules = true;
                case "compensation", "compensate" -> compensation = true;
                case "loop", "foreach", "while", "until" -> loops = true;
                case "parallel" -> parallel = true;
                case "listen" -> listen = true;
                case "delay" -> delay = true;
                case "call", "start", "startorchestration" -> callOrchestration = true;
                case "transform" -> transform = true;
                default -> {
                    // no flag for this type
                }
            }
        }
    }
}
