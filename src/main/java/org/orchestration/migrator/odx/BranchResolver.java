package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the branch payloads of Decide, Switch and Listen nodes. Every branch or
 * case container is parsed in its own context, so sequence numbers restart at zero,
 * and its shapes get the owning node as parent without being listed as its generic children.
 */
public class BranchResolver {
    public static final String DECISION_BRANCH = "DecisionBranch";
    public static final Set<String> LISTEN_BRANCH_TYPES = Set.of("ListenBranch", "Task");

    private final ShapeTreeParser parser;
    private final OdxElementReader reader;
    private final ParseState state;
    private final ShapeTree tree;

    BranchResolver(ShapeTreeParser parser, OdxElementReader reader, ParseState state) {
        this.parser = parser;
        this.reader = reader;
        this.state = state;
        this.tree = state.tree();
    }

    /**
     * The first branch with a condition is the true branch and supplies the condition;
     * the first remaining branch is the false branch. Without any condition the branches
     * are taken by position and the condition is looked up next to them. If the condition
     * is still empty, an Expression shape at the top of the true branch provides it.
     */
    ShapePayload resolveDecide(Element element, ShapeNode node, ParseContext context) {
        List<Element> branches = reader.childElements(element, DECISION_BRANCH);
        Element trueBranch = null;
        Element falseBranch = null;
        String condition = "";

        for (Element branch : branches) {
            String expression = expressionOf(branch);
            if (!expression.isBlank()) {
                trueBranch = branch;
                condition = expression;
                break;
            }
        }

        if (trueBranch != null) {
            for (Element branch : branches) {
                if (branch != trueBranch) {
                    falseBranch = branch;
                    break;
                }
            }
        } else {
            condition = reader.eval(element,
                    "om:Element[@Type='Expression']/om:Property[@Name='Expression']/@Value");
            if (!branches.isEmpty()) {
                trueBranch = branches.get(0);
            }
            if (branches.size() > 1) {
                falseBranch = branches.get(1);
            }
        }

        for (Element branch : branches) {
            if (branch != trueBranch && branch != falseBranch) {
                state.listener().branchIgnored(node, reader.property(branch, "Name"));
            }
        }

        List<Integer> trueShapes = trueBranch == null
                ? new ArrayList<>()
                : parser.parseShapes(trueBranch, ShapeTreeParser.subContext(context, node, "true"), node.handle());
        List<Integer> falseShapes = falseBranch == null
                ? new ArrayList<>()
                : parser.parseShapes(falseBranch, ShapeTreeParser.subContext(context, node, "false"), node.handle());

        if (condition.isBlank()) {
            condition = promotedCondition(trueShapes);
        }
        return new ShapePayload.Decide(condition, trueShapes, falseShapes);
    }

    /**
     * Case containers are keyed by their own Expression property, then their name, then {@code Case_N}.
     * An Expression shape inside a case is a statement of that case, never its value; only the
     * discriminant falls back to one. A container with no expression, or named like a default/else
     * case, goes to the default slot.
     * Containers with the same key share one concatenated list.
     */
    ShapePayload resolveSwitch(Element element, ShapeNode node, ParseContext context) {
        String discriminant = expressionOf(element);
        Map<String, List<Integer>> cases = new LinkedHashMap<>();
        List<Integer> defaultCase = new ArrayList<>();

        int index = 0;
        for (Element caseElement : reader.childElements(element, DECISION_BRANCH)) {
            index++;
            String caseName = reader.property(caseElement, "Name");
            String caseExpression = reader.property(caseElement, "Expression");
            List<Integer> shapes = parser.parseShapes(caseElement,
                    ShapeTreeParser.subContext(context, node, "case" + index), node.handle());

            if (isDefaultCase(caseName, caseExpression)) {
                defaultCase.addAll(shapes);
                continue;
            }
            String key;
            if (!caseExpression.isBlank()) {
                key = caseExpression;
            } else if (!caseName.isBlank()) {
                key = caseName;
            } else {
                key = "Case_" + index;
            }
            cases.computeIfAbsent(key, k -> new ArrayList<>()).addAll(shapes);
        }
        return new ShapePayload.Switch(discriminant, cases, defaultCase);
    }

    /**
     * Each ListenBranch (or Task) container becomes one branch list. These lists are the
     * only place branch shapes are recorded; the containers are left out of the generic recursion.
     */
    ShapePayload resolveListen(Element element, ShapeNode node, ParseContext context) {
        List<List<Integer>> branches = new ArrayList<>();
        int index = 0;
        for (Element branch : reader.childElements(element)) {
            if (!LISTEN_BRANCH_TYPES.contains(reader.type(branch))) {
                continue;
            }
            index++;
            branches.add(parser.parseShapes(branch,
                    ShapeTreeParser.subContext(context, node, "branch" + index), node.handle()));
        }
        return new ShapePayload.Listen(branches);
    }

    static boolean isDefaultCase(String caseName, String caseExpression) {
        if (caseExpression == null || caseExpression.isBlank()) {
            return true;
        }
        String lower = caseName == null ? "" : caseName.toLowerCase(Locale.ROOT);
        return lower.contains("default") || lower.contains("else");
    }

    private String expressionOf(Element element) {
        String expression = reader.property(element, "Expression");
        if (expression.isBlank()) {
            expression = reader.eval(element,
                    "om:Element[@Type='Expression']/om:Property[@Name='Expression']/@Value");
        }
        return expression;
    }

    private String promotedCondition(List<Integer> trueShapes) {
        for (int handle : trueShapes) {
            ShapeNode shape = tree.node(handle);
            if (shape.is(ShapeKind.EXPRESSION)) {
                String expression = shape.payload(ShapePayload.Expression.class).expression();
                if (!expression.isBlank()) {
                    return expression;
                }
            }
        }
        return "";
    }
}
