package org.orchestration.migrator.analysis;

import org.orchestration.migrator.odx.models.OrchestrationModel;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable views of a parsed model, used when checking what the parser made of a file.
 */
public class ShapeTreeDiagnostics {
    private static final String INDENT = "  ";

    /**
     * Shape type -> number of nodes, over the whole tree, sorted by type.
     */
    public static Map<String, Integer> countShapes(OrchestrationModel model) {
        Map<String, Integer> counts = new TreeMap<>();
        for (ShapeNode shape : model.allShapes()) {
            counts.merge(shape.shapeType(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Indented dump of the shape hierarchy, branch and case labels included.
     */
    public static String dumpHierarchy(OrchestrationModel model) {
        StringBuilder out = new StringBuilder();
        out.append("Orchestration ").append(model.fullName())
                .append(" (").append(model.allShapes().size()).append(" shapes)\n");
        for (ShapeNode shape : model.shapes()) {
            dump(model.tree(), shape, 1, out);
        }
        return out.toString();
    }

    private static void dump(ShapeTree tree, ShapeNode node, int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth))
                .append('[').append(node.sequence()).append("] ")
                .append(node.shapeType()).append(": ").append(node.name());
        if (!node.oid().isEmpty()) {
            out.append(" {").append(node.oid()).append('}');
        }
        out.append('\n');

        for (ShapeNode child : tree.childrenOf(node)) {
            dump(tree, child, depth + 1, out);
        }

        ShapePayload payload = node.payload();
        if (payload instanceof ShapePayload.Decide decide) {
            label("true: " + decide.condition(), depth + 1, out);
            dumpAll(tree, decide.trueBranch(), depth + 2, out);
            label("false", depth + 1, out);
            dumpAll(tree, decide.falseBranch(), depth + 2, out);
        } else if (payload instanceof ShapePayload.Switch switchPayload) {
            switchPayload.cases().forEach((key, handles) -> {
                label("case " + key, depth + 1, out);
                dumpAll(tree, handles, depth + 2, out);
            });
            label("default", depth + 1, out);
            dumpAll(tree, switchPayload.defaultCase(), depth + 2, out);
        } else if (payload instanceof ShapePayload.Listen listen) {
            for (int i = 0; i < listen.branches().size(); i++) {
                label("branch " + (i + 1), depth + 1, out);
                dumpAll(tree, listen.branches().get(i), depth + 2, out);
            }
        }
    }

    private static void dumpAll(ShapeTree tree, List<Integer> handles, int depth, StringBuilder out) {
        for (ShapeNode node : tree.resolve(handles)) {
            dump(tree, node, depth, out);
        }
    }

    private static void label(String text, int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth)).append("<").append(text).append(">\n");
    }
}
