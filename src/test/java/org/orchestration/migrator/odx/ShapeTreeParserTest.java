package org.orchestration.migrator.odx;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ShapeTreeParserTest {
    private static final String ADVANCED_SHAPES_ODX = "src/test/resources/odx/AdvancedShapes.odx";

    private OrchestrationModel model;
    private ShapeTree tree;
    private RecordingListener listener;

    @BeforeEach
    void setUp() throws IOException {
        listener = new RecordingListener();
        model = OdxHelper.parseOdxFile(Path.of(ADVANCED_SHAPES_ODX), listener);
        tree = model.tree();
    }

    @Test
    void shouldKeepTopLevelShapesInDocumentOrder() {
        assertEquals(List.of("Receive", "Listen", "Switch", "Construct", "ForEach", "Scope",
                        "CorrelationDeclaration", "Send"),
                model.shapes().stream().map(ShapeNode::shapeType).toList());
        assertEquals(25, tree.size());
        assertEquals(25, model.allShapes().size());
    }

    @Test
    void shouldIndexEveryOidOnceWithFirstRegistrationWinning() {
        for (ShapeNode node : tree.allNodes()) {
            if (!node.oid().isEmpty()) {
                assertTrue(tree.findByOid(node.oid()).isPresent(), node.oid());
            }
        }
        assertEquals(new HashSet<>(tree.oidIndex().values()).size(), tree.oidIndex().size());

        // snd-north is declared in the first Switch case and again by the last top-level Send
        ShapeNode indexed = tree.findByOid("snd-north").orElseThrow();
        assertEquals("SendNorth", indexed.name());
        assertEquals("SendResponse", model.shapes().get(7).name());
        assertEquals("snd-north", model.shapes().get(7).oid());
    }

    @Test
    void shouldNumberShapesPerContext() {
        Map<String, Set<Integer>> sequencesByContext = new HashMap<>();
        for (ShapeNode node : tree.allNodes()) {
            String context = node.uniqueId().substring(node.uniqueId().indexOf('@') + 1, node.uniqueId().lastIndexOf('#'));
            assertTrue(sequencesByContext.computeIfAbsent(context, k -> new HashSet<>()).add(node.sequence()),
                    "duplicate sequence in " + context);
        }

        assertEquals("rcv-request@body#0", model.shapes().get(0).uniqueId());
        assertEquals("snd-north@body/Switch#2.case1#0", tree.findByOid("snd-north").orElseThrow().uniqueId());
        assertEquals("snd-north-copy@body/Switch#2.case2#0", tree.findByOid("snd-north-copy").orElseThrow().uniqueId());
        assertEquals("snd-north@body#13", model.shapes().get(7).uniqueId());
    }

    @Test
    void shouldTakeListenBranchesFromBranchListOnly() {
        ShapeNode listen = model.shapes().get(1);
        ShapePayload.Listen payload = listen.payload(ShapePayload.Listen.class);

        // the branch list is authoritative: branch shapes are never mirrored as generic children
        assertTrue(listen.children().isEmpty());
        assertEquals(2, payload.branches().size());
        assertEquals(List.of("ReceiveReply", "SendAck"),
                tree.listenBranch(listen, 0).stream().map(ShapeNode::name).toList());
        assertEquals(List.of("Timeout", "GiveUp"),
                tree.listenBranch(listen, 1).stream().map(ShapeNode::name).toList());

        for (ShapeNode shape : tree.resolve(tree.branchHandles(listen))) {
            assertEquals(listen.handle(), shape.parent());
        }
        assertEquals("rcv-reply@body/Listen#1.branch1#0", tree.listenBranch(listen, 0).get(0).uniqueId());
        assertEquals("trm-giveup@body/Listen#1.branch2#1", tree.listenBranch(listen, 1).get(1).uniqueId());
    }

    @Test
    void shouldConcatenateSwitchCasesWithSameKey() {
        ShapeNode switchNode = model.shapes().get(2);
        ShapePayload.Switch payload = switchNode.payload(ShapePayload.Switch.class);

        assertEquals("RequestMsg.Region", payload.discriminant());
        assertEquals(List.of("1", "2"), List.copyOf(payload.cases().keySet()));
        assertEquals(List.of("SendNorth", "SendNorthCopy"),
                tree.switchCase(switchNode, "1").stream().map(ShapeNode::name).toList());
        assertEquals(List.of("Expression", "Send"),
                tree.switchCase(switchNode, "2").stream().map(ShapeNode::shapeType).toList());
        assertEquals(List.of("SuspendUnknownRegion"),
                tree.defaultCase(switchNode).stream().map(ShapeNode::name).toList());
        assertTrue(switchNode.children().isEmpty());
    }

    @Test
    void shouldParseConstructInnerShapesInline() {
        ShapeNode construct = model.shapes().get(3);
        ShapePayload.Construct payload = construct.payload(ShapePayload.Construct.class);

        assertEquals(List.of("ResponseMsg"), payload.constructedMessages());
        assertEquals(payload.innerShapes(), construct.children());

        ShapeNode transform = tree.node(payload.innerShapes().get(0));
        assertEquals("trf-map@body/Construct#3.inner#0", transform.uniqueId());
        ShapePayload.Transform map = transform.payload(ShapePayload.Transform.class);
        assertEquals("Contoso.Maps.RequestToResponse", map.className());
        assertEquals(List.of("RequestMsg"), map.inputMessages());
        assertEquals(List.of("ResponseMsg"), map.outputMessages());

        ShapeNode assignment = tree.node(payload.innerShapes().get(1));
        assertEquals(ShapeKind.MESSAGE_ASSIGNMENT, assignment.kind());
        assertEquals("ResponseMsg(BTS.Operation) = \"Reply\";",
                assignment.payload(ShapePayload.Expression.class).expression());
    }

    @Test
    void shouldParseShapesNestedInTransform() {
        RecordingListener transformListener = new RecordingListener();
        OrchestrationModel transformModel = OdxHelper.parseOdxContent(OdxTestContent.odx(
                OdxTestContent.element("Transform", "t1",
                        OdxTestContent.property("ClassName", "Maps.InToOut"),
                        OdxTestContent.element("MessagePartRef", "p1", OdxTestContent.property("MessageRef", "In")),
                        OdxTestContent.element("Expression", "e1", OdxTestContent.property("Expression", "x = 1;")))),
                transformListener);
        ShapeNode transform = transformModel.shapes().get(0);

        assertEquals(List.of("In"), transform.payload(ShapePayload.Transform.class).inputMessages());
        assertEquals(List.of("e1@body#1"),
                transformModel.tree().childrenOf(transform).stream().map(ShapeNode::uniqueId).toList());
        assertTrue(transformListener.skippedTypes.contains("MessagePartRef"));
    }

    @Test
    void shouldReadLoopCollectionAndIterator() {
        ShapeNode forEach = model.shapes().get(4);
        ShapePayload.Loop loop = forEach.payload(ShapePayload.Loop.class);

        assertEquals(ShapeKind.LOOP, forEach.kind());
        assertEquals("ForEach", forEach.shapeType());
        assertEquals("RequestMsg.Lines", loop.collectionExpression());
        assertEquals("line", loop.iteratorVariable());
        assertEquals(List.of("Expression", "VariableAssignment"),
                tree.childrenOf(forEach).stream().map(ShapeNode::shapeType).toList());
    }

    @Test
    void shouldDefaultLoopIteratorName() {
        OrchestrationModel loopModel = OdxHelper.parseOdxContent(OdxTestContent.odx(
                OdxTestContent.element("Loop", "l1", OdxTestContent.property("Expression", "items"))), null);

        ShapePayload.Loop loop = loopModel.shapes().get(0).payload(ShapePayload.Loop.class);
        assertEquals("items", loop.collectionExpression());
        assertEquals("item", loop.iteratorVariable());
    }

    @Test
    void shouldRecognizeRulesCallsAndFallbacks() {
        ShapeNode scope = model.shapes().get(5);
        List<ShapeNode> children = tree.childrenOf(scope);

        assertEquals(3, children.size());
        ShapeNode rules = children.get(0);
        assertEquals(ShapeKind.CALL_RULES, rules.kind());
        assertEquals("CallRules", rules.shapeType());
        assertEquals("Execute_Rules_Engine_ContosoCreditCheckPolicy", rules.name());

        ShapeNode unknown = children.get(1);
        assertEquals(ShapeKind.FALLBACK, unknown.kind());
        assertEquals("CustomWidget", unknown.shapeType());
        assertEquals("Unknown_CustomWidget", unknown.name());

        ShapePayload.Catch handler = children.get(2).payload(ShapePayload.Catch.class);
        assertEquals("System.Exception", handler.exceptionType());
        assertEquals("ex", handler.exceptionVariable());
        assertEquals("ex", tree.childrenOf(children.get(2)).get(0).payload(ShapePayload.Terminate.class).errorMessage());

        assertEquals(List.of("CustomWidget"), listener.unknownTypes);
        assertTrue(listener.skippedTypes.contains("TransactionAttribute"));
        assertTrue(listener.skippedTypes.contains("IteratorVariable"));
    }

    @Test
    void shouldLinkEveryGenericChildToItsParent() {
        for (ShapeNode node : tree.allNodes()) {
            for (ShapeNode child : tree.childrenOf(node)) {
                assertEquals(node.handle(), child.parent());
            }
        }
        for (ShapeNode top : model.shapes()) {
            assertFalse(top.hasParent());
        }
    }

    @Test
    void shouldDefaultSuspendMessage() {
        ShapeNode suspend = tree.findByOid("sus-unknown").orElseThrow();

        assertEquals("Suspended", suspend.payload(ShapePayload.Terminate.class).errorMessage());
    }

    @Test
    void shouldNameRulesShapes() {
        assertEquals("Execute_Rules_Engine", ShapeTreeParser.rulesShapeName(""));
        assertEquals("Execute_Rules_Engine", ShapeTreeParser.rulesShapeName("--"));
        assertEquals("Execute_Rules_Engine_" + "A".repeat(40), ShapeTreeParser.rulesShapeName("A".repeat(45)));
    }
}
