package org.orchestration.migrator.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.orchestration.migrator.analysis.models.AnalysisResult;
import org.orchestration.migrator.analysis.models.GapAnalysisReport;
import org.orchestration.migrator.analyzerConfig.models.AnalyzerConfig;
import org.orchestration.migrator.odx.OdxHelper;
import org.orchestration.migrator.odx.ParseListener;
import org.orchestration.migrator.odx.models.OrchestrationModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.orchestration.migrator.odx.OdxTestContent.*;

class OdxAnalyzerTest {
    private static final String ORDER_PROCESS_ODX = "src/test/resources/odx/OrderProcess.odx";
    private static final String ADVANCED_SHAPES_ODX = "src/test/resources/odx/AdvancedShapes.odx";
    private static final String MISSING_SENTINEL_ODX = "src/test/resources/odx/MissingSentinel.odx";
    private static final String BATCH_DIR = "src/test/resources/odx/batch";

    private static AnalysisResult analyze(String... body) {
        OrchestrationModel model = OdxHelper.parseOdxContent(odx(body), ParseListener.NONE);
        return OdxAnalyzer.analyzeModel(model, "inline.odx", 0);
    }

    @Test
    void shouldCountShapesInsideBranches() {
        AnalysisResult result = OdxAnalyzer.analyzeFile(Path.of(ORDER_PROCESS_ODX));

        assertTrue(result.parsedSuccessfully());
        assertEquals("Contoso.Orders.OrderProcess", result.orchestrationName());
        assertEquals(1, result.shapeTypeCounts().get("Receive"));
        assertEquals(1, result.shapeTypeCounts().get("Decide"));
        assertEquals(3, result.shapeTypeCounts().get("Send"));
        assertTrue(result.unsupportedShapes().isEmpty());
        assertTrue(result.hasContentBasedRouting());
        assertTrue(result.hasSolicitResponse());
        assertFalse(result.hasMessageBroker());
        assertEquals(2, result.portCount());
        assertEquals(2, result.messageCount());
        assertTrue(result.fileSizeBytes() > 0);
    }

    @Test
    void shouldClassifyUnsupportedAndPartialShapes() {
        AnalysisResult result = OdxAnalyzer.analyzeFile(Path.of(ADVANCED_SHAPES_ODX));

        assertEquals(List.of("CustomWidget"), result.unsupportedShapes());
        assertEquals(List.of("CallRules"), result.partiallySupportedShapes());
        assertEquals(5, result.shapeTypeCounts().get("Send"));
        assertEquals(2, result.shapeTypeCounts().get("Expression"));
        assertTrue(result.hasCorrelationSets());
        assertTrue(result.hasBusinessRules());
        assertTrue(result.hasLoops());
        assertTrue(result.hasListen());
        assertTrue(result.hasDelay());
        assertTrue(result.hasExceptionHandling());
        assertTrue(result.hasTransform());
        assertTrue(result.hasAggregatorPattern());
        assertFalse(result.hasConvoy());
        assertFalse(result.hasParallel());
        assertEquals(1, result.correlationSetCount());
    }

    @Test
    void shouldDetectConvoyFromTwoActivatingReceives() {
        AnalysisResult result = analyze(receive("r1", "First", true), receive("r2", "Second", true));

        assertTrue(result.hasConvoy());
        assertFalse(result.hasCorrelationSets());
    }

    @Test
    void shouldDetectConvoyFromTwoCorrelationSets() {
        AnalysisResult result = analyze(
                receive("r1", "First", true),
                correlation("c1", "SetA", "r1", true),
                correlation("c2", "SetB", "r1", true));

        assertTrue(result.hasConvoy());
        assertEquals(2, result.correlationSetCount());
    }

    @Test
    void shouldDetectAggregatorOnlyWithConstructOrTransform() {
        AnalysisResult withConstruct = analyze(
                receive("r1", "First", true),
                receive("r2", "Second", false),
                correlation("c1", "Batch", "r2", false),
                element("Construct", "k1", property("Name", "Build")));
        AnalysisResult withoutConstruct = analyze(
                receive("r1", "First", true),
                receive("r2", "Second", false),
                correlation("c1", "Batch", "r2", false));

        assertTrue(withConstruct.hasAggregatorPattern());
        assertFalse(withoutConstruct.hasAggregatorPattern());
    }

    @Test
    void shouldDetectScatterGatherAndMessageBroker() {
        AnalysisResult scatter = analyze(
                element("Parallel", "p1",
                        element("ParallelBranch", "pb1", send("s1", "A"), receive("r1", "RA", false)),
                        element("ParallelBranch", "pb2", send("s2", "B"), receive("r2", "RB", false))));
        AnalysisResult broker = analyze(
                receive("r1", "In1", true),
                receive("r2", "In2", false),
                element("Decide", "d1",
                        branch("b1", "A", "x", send("s1", "OutA")),
                        branch("b2", "B", null, send("s2", "OutB"))));

        assertTrue(scatter.hasScatterGather());
        assertTrue(scatter.hasParallel());
        assertFalse(scatter.hasMessageBroker());
        assertTrue(broker.hasMessageBroker());
        assertTrue(broker.hasContentBasedRouting());
        assertFalse(broker.hasScatterGather());
    }

    @Test
    void shouldCaptureFailureInsteadOfThrowing() {
        AnalysisResult result = OdxAnalyzer.analyzeFile(Path.of(MISSING_SENTINEL_ODX));

        assertFalse(result.parsedSuccessfully());
        assertTrue(result.parseError().contains("#endif"));
        assertEquals("MissingSentinel.odx", result.fileName());
    }

    @Test
    void shouldCaptureMissingFile() {
        AnalysisResult result = OdxAnalyzer.analyzeFile(Path.of("src/test/resources/odx/Nope.odx"));

        assertFalse(result.parsedSuccessfully());
        assertTrue(result.parseError().startsWith("Cannot read file"));
    }

    @Test
    void shouldDescribeFailuresWithoutMessage() {
        assertEquals("java.lang.IllegalArgumentException", OdxAnalyzer.failureMessage(new IllegalArgumentException()));
        assertEquals("java.lang.IllegalStateException: ",
                OdxAnalyzer.failureMessage(new IllegalStateException("")));
        assertEquals("bad shape", OdxAnalyzer.failureMessage(new IllegalStateException("bad shape")));
    }

    @Test
    void shouldContinueDirectoryScanAfterBadFile() throws IOException {
        GapAnalysisReport report = OdxAnalyzer.analyzeDirectory(Path.of(BATCH_DIR));

        assertEquals(3, report.totalFilesAnalyzed);
        assertEquals(2, report.successfullyParsed);
        assertEquals(1, report.failedToParse);
        assertEquals(List.of("A_OrderProcess.odx", "B_Broken.odx", "C_RegionRouter.odx"),
                report.fileDetails.stream().map(AnalysisResult::fileName).toList());
        assertFalse(report.fileDetails.get(1).parsedSuccessfully());
        assertEquals(8, report.shapeTypeFrequency.get("Send"));
        assertEquals(1, report.unsupportedShapeFrequency.get("CustomWidget"));
        assertEquals(List.of("C_RegionRouter.odx"), report.unsupportedShapeExamples.get("CustomWidget"));
        assertEquals(List.of("A_OrderProcess.odx"), report.filesWithContentBasedRouting);
        assertEquals(List.of("C_RegionRouter.odx"), report.filesWithAggregator);
        assertFalse(report.cancelled);
    }

    @Test
    void shouldOrderRecommendationsByPriority() throws IOException {
        GapAnalysisReport report = OdxAnalyzer.analyzeDirectory(Path.of(BATCH_DIR));

        List<String> recommendations = report.recommendedFeatures;
        assertEquals(6, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("P0 - Business Rules Engine Support: 1 files"));
        assertTrue(recommendations.get(1).startsWith("P0 - Advanced Correlation Support"));
        assertTrue(recommendations.get(2).startsWith("P2 - Aggregator Pattern"));
        assertTrue(recommendations.get(3).startsWith("P2 - Content-Based Routing"));
        assertTrue(recommendations.get(4).startsWith("P3 - Hybrid Deployment Option"));
        assertEquals("P? - Support for 'CustomWidget' shape: Found in 1 files (C_RegionRouter.odx)",
                recommendations.get(5));
    }

    @Test
    void shouldSortUnsupportedRecommendationsByFrequency() {
        GapAnalysisReport report = new GapAnalysisReport();
        report.unsupportedShapeFrequency.put("Rare", 1);
        report.unsupportedShapeFrequency.put("Common", 4);
        report.unsupportedShapeExamples.put("Common", List.of("a.odx", "b.odx"));

        OdxAnalyzer.generateRecommendations(report);

        assertEquals(3, report.recommendedFeatures.size());
        assertEquals("P? - Support for 'Common' shape: Found in 4 files (a.odx, b.odx)", report.recommendedFeatures.get(1));
        assertEquals("P? - Support for 'Rare' shape: Found in 1 files ()", report.recommendedFeatures.get(2));
    }

    @Test
    void shouldCapUnsupportedExamples() {
        GapAnalysisReport report = new GapAnalysisReport();
        for (int i = 0; i < 5; i++) {
            OdxAnalyzer.aggregate(report, AnalysisResult.builder()
                    .fileName("f" + i + ".odx")
                    .parsedSuccessfully(true)
                    .unsupportedShapes(List.of("Odd"))
                    .build(), 3);
        }

        assertEquals(5, report.unsupportedShapeFrequency.get("Odd"));
        assertEquals(List.of("f0.odx", "f1.odx", "f2.odx"), report.unsupportedShapeExamples.get("Odd"));
        assertEquals(5, report.successfullyParsed);
    }

    @Test
    void shouldStopWhenCancelled(@TempDir Path tempDir) throws IOException {
        for (String name : List.of("one.odx", "two.odx", "three.odx")) {
            Files.writeString(tempDir.resolve(name), odx(send("s1", "Out")));
        }
        AtomicInteger checks = new AtomicInteger();

        GapAnalysisReport report = OdxAnalyzer.analyzeDirectory(tempDir, AnalyzerConfig.defaults(),
                () -> checks.incrementAndGet() > 1);

        assertTrue(report.cancelled);
        assertEquals(3, report.totalFilesAnalyzed);
        assertEquals(1, report.fileDetails.size());
        assertEquals("one.odx", report.fileDetails.get(0).fileName());
    }

    @Test
    void shouldHonourExtensionAndSubdirectorySettings(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("top.ODX"), odx(send("s1", "Out")));
        Files.writeString(tempDir.resolve("other.xml"), "<x/>");
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested").resolve("deep.odx"), odx(send("s1", "Out")));

        AnalyzerConfig config = AnalyzerConfig.defaults();
        assertEquals(1, OdxAnalyzer.listSourceFiles(tempDir, config).size());

        config.includeSubdirectories = true;
        assertEquals(2, OdxAnalyzer.listSourceFiles(tempDir, config).size());
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThrows(IOException.class, () -> OdxAnalyzer.analyzeDirectory(Path.of("src/test/resources/odx/none")));
    }
}
