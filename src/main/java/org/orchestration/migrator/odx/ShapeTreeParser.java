package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.CorrelationReference;
import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent builder turning designer elements into {@link ShapeNode}s.
 * Each element is dispatched on its {@code Type} attribute to a per-kind builder;
 * unknown types become fallback nodes so they can still be counted.
 */
public class ShapeTreeParser {
    private static final String CALL_RULES = "CallRules";
    private static final String CALL_POLICY = "CallPolicy";
    private static final int MAX_POLICY_SEGMENT = 40;

    // elements carrying data for their parent shape, never shapes themselves
    private static final Set<String> DATA_ELEMENT_TYPES = Set.of(
            "TransactionAttribute", "MessageRef", "MessagePartRef", "StatementRef", "IteratorVariable");
    private static final Set<String> CONSTRUCT_INNER_TYPES = Set.of("Transform", "MessageAssignment");

    private final OdxElementReader reader;
    private final ParseState state;
    private final ShapeTree tree;
    private final BranchResolver branchResolver;
    private final Map<String, ShapeDescriptor> descriptors = new HashMap<>();

    public ShapeTreeParser(OdxElementReader reader, ParseState state) {
        this.reader = reader;
        this.state = state;
        this.tree = state.tree();
        this.branchResolver = new BranchResolver(this, reader, state);
        registerDescriptors();
    }

    /**
     * Parses every child element of {@code container} into nodes owned by {@code parent}.
     * The caller decides whether the returned nodes are linked as generic children
     * or stored in a branch payload.
     *
     * @param container the element whose {@code om:Element} children are parsed
     * @param context   the parsing context supplying sequence numbers
     * @param parent    handle of the owning node, or {@link ShapeNode#NO_PARENT}
     * @return handles of the nodes created directly under the container, in document order
     */
    public List<Integer> parseShapes(Element container, ParseContext context, int parent) {
        return parseShapes(container, context, parent, Set.of());
    }

    List<Integer> parseShapes(Element container, ParseContext context, int parent, Set<String> skippedTypes) {
        List<Integer> created = new ArrayList<>();
        for (Element child : reader.childElements(container)) {
            if (skippedTypes.contains(reader.type(child))) {
                continue;
            }
            parseShape(child, context, parent).ifPresent(node -> created.add(node.handle()));
        }
        return created;
    }

    /**
     * Builds one node and, unless its kind handles its own substructure, its generic children.
     *
     * @return the node, or empty for metadata elements that produce no node
     */
    public Optional<ShapeNode> parseShape(Element element, ParseContext context, int parent) {
        String type = reader.type(element);
        String oid = reader.oid(element);
        if (DATA_ELEMENT_TYPES.contains(type)) {
            state.listener().metadataSkipped(type, oid);
            return Optional.empty();
        }

        ShapeDescriptor descriptor = describe(element, type);
        int sequence = context.nextSequence();
        String name = reader.property(element, "Name");
        if (name.isBlank()) {
            name = descriptor.defaultName();
        }
        String shapeType = descriptor.shapeType() == null ? type : descriptor.shapeType();

        ShapeNode node = tree.add(oid, name, descriptor.kind(), shapeType, sequence,
                uniqueId(oid, shapeType, context, sequence), parent);
        tree.register(oid, node);
        tree.attach(node, descriptor.builder().build(element, node, context));
        state.listener().shapeParsed(node);

        if (descriptor.recursive()) {
            Set<String> skipped = node.is(ShapeKind.LISTEN) ? BranchResolver.LISTEN_BRANCH_TYPES : Set.of();
            for (int child : parseShapes(element, context, node.handle(), skipped)) {
                tree.link(node.handle(), child);
            }
        }
        return Optional.of(node);
    }

    /**
     * A context for a sub-region owned by {@code owner}, e.g. {@code body/Decide#2.true}.
     */
    static ParseContext subContext(ParseContext context, ShapeNode owner, String label) {
        return context.isolated(owner.shapeType() + "#" + owner.sequence() + "." + label);
    }

    static String uniqueId(String oid, String shapeType, ParseContext context, int sequence) {
        String key = oid == null || oid.isEmpty() ? shapeType : oid;
        return key + "@" + context.path() + "#" + sequence;
    }

    /**
     * Name given to a rules call without an explicit name.
     *
     * @param policy the policy identifier, may be empty
     * @return {@code Execute_Rules_Engine} or {@code Execute_Rules_Engine_<policy>}
     */
    static String rulesShapeName(String policy) {
        if (policy == null || policy.isBlank()) {
            return "Execute_Rules_Engine";
        }
        String segment = policy.replaceAll("[^A-Za-z0-9]", "");
        if (segment.length() > MAX_POLICY_SEGMENT) {
            segment = segment.substring(0, MAX_POLICY_SEGMENT);
        }
        return segment.isEmpty() ? "Execute_Rules_Engine" : "Execute_Rules_Engine_" + segment;
    }

    private ShapeDescriptor describe(Element element, String type) {
        // legacy designers write these with inconsistent casing
        if (CALL_RULES.equalsIgnoreCase(type) || CALL_POLICY.equalsIgnoreCase(type)) {
            String policy = reader.firstProperty(element, "Policy", "PolicyName", "Ruleset");
            return new ShapeDescriptor(ShapeKind.CALL_RULES, CALL_RULES, rulesShapeName(policy), true,
                    (el, node, ctx) -> new ShapePayload.CallRules(policy));
        }
        ShapeDescriptor descriptor = descriptors.get(type);
        if (descriptor != null) {
            return descriptor;
        }
        return new ShapeDescriptor(ShapeKind.FALLBACK, null, "Unknown_" + type, true, (el, node, ctx) -> {
            state.listener().unknownShape(type, node.oid());
            return new ShapePayload.Fallback(type, "Unhandled shape type: " + type);
        });
    }

    private void registerDescriptors() {
        ShapeBuilder container = (el, node, ctx) -> new ShapePayload.Container();

        register(new ShapeDescriptor(ShapeKind.RECEIVE, "Receive", "", true, this::buildReceive), "Receive");
        register(new ShapeDescriptor(ShapeKind.SEND, "Send", "", true, this::buildSend), "Send");
        register(new ShapeDescriptor(ShapeKind.CONSTRUCT, "Construct", "", false, this::buildConstruct), "Construct");
        register(new ShapeDescriptor(ShapeKind.TRANSFORM, "Transform", "", true, this::buildTransform), "Transform");
        register(new ShapeDescriptor(ShapeKind.MESSAGE_ASSIGNMENT, "MessageAssignment", "", true,
                expressionProperty()), "MessageAssignment");
        register(new ShapeDescriptor(ShapeKind.VARIABLE_ASSIGNMENT, "VariableAssignment", "", true,
                expressionProperty()), "VariableAssignment");
        register(new ShapeDescriptor(ShapeKind.WHILE, "While", "", true, expressionProperty()), "While");
        register(new ShapeDescriptor(ShapeKind.UNTIL, "Until", "", true, expressionProperty()), "Until");
        register(new ShapeDescriptor(ShapeKind.EXPRESSION, "Expression", "", true, expressionProperty()), "Expression");
        register(new ShapeDescriptor(ShapeKind.DELAY, "Delay", "", true, expressionProperty()), "Delay");
        register(new ShapeDescriptor(ShapeKind.LOOP, null, "", true, this::buildLoop), "Loop", "ForEach");
        register(new ShapeDescriptor(ShapeKind.CALL, "Call", "", true,
                (el, node, ctx) -> new ShapePayload.Invoke(reader.property(el, "Invokee"))), "Call");
        register(new ShapeDescriptor(ShapeKind.START_ORCHESTRATION, "StartOrchestration", "", true,
                (el, node, ctx) -> new ShapePayload.Invoke(reader.property(el, "Invokee"))),
                "Exec", "Start", "StartOrchestration");
        register(new ShapeDescriptor(ShapeKind.CORRELATION_DECLARATION, "CorrelationDeclaration", "", true,
                this::buildCorrelationDeclaration), "CorrelationDeclaration");

        register(new ShapeDescriptor(ShapeKind.DECIDE, "Decide", "", false, branchResolver::resolveDecide),
                "Decision", "Decide", "If", "IfElse");
        register(new ShapeDescriptor(ShapeKind.SWITCH, "Switch", "", false, branchResolver::resolveSwitch), "Switch");
        register(new ShapeDescriptor(ShapeKind.LISTEN, "Listen", "Listen", true, branchResolver::resolveListen), "Listen");

        register(new ShapeDescriptor(ShapeKind.THROW, "Throw", "", true, (el, node, ctx) ->
                new ShapePayload.Terminate(reader.firstProperty(el, "Exception", "ExceptionType"))), "Throw");
        register(new ShapeDescriptor(ShapeKind.SUSPEND, "Suspend", "", true, (el, node, ctx) ->
                new ShapePayload.Terminate(orDefault(reader.property(el, "ErrorMessage"), "Suspended"))), "Suspend");
        register(new ShapeDescriptor(ShapeKind.TERMINATE, "Terminate", "", true, (el, node, ctx) ->
                new ShapePayload.Terminate(reader.property(el, "ErrorMessage"))), "Terminate");
        register(new ShapeDescriptor(ShapeKind.COMPENSATE, "Compensate", "", true, (el, node, ctx) ->
                new ShapePayload.Compensate(reader.property(el, "Target"))), "Compensate");
        register(new ShapeDescriptor(ShapeKind.CATCH, null, "", true, (el, node, ctx) ->
                new ShapePayload.Catch(
                        orDefault(reader.firstProperty(el, "ExceptionType", "Exception"), "System.Exception"),
                        orDefault(reader.firstProperty(el, "ExceptionName", "ExceptionVariable"), "ex"))),
                "Catch", "CatchException");
        register(new ShapeDescriptor(ShapeKind.VARIABLE_DECLARATION, "VariableDeclaration", "", true, (el, node, ctx) ->
                new ShapePayload.VariableDeclaration(reader.property(el, "Type"),
                        "True".equalsIgnoreCase(reader.property(el, "UseDefaultConstructor")))),
                "VariableDeclaration", "MessageDeclaration");

        register(new ShapeDescriptor(ShapeKind.SCOPE, "Scope", "", true, container), "Scope");
        register(new ShapeDescriptor(ShapeKind.GROUP, "Group", "", true, container), "Group");
        register(new ShapeDescriptor(ShapeKind.PARALLEL, "Parallel", "", true, container), "Parallel");
        register(new ShapeDescriptor(ShapeKind.PARALLEL_BRANCH, "ParallelBranch", "ParallelBranch", true, container),
                "ParallelBranch");
        register(new ShapeDescriptor(ShapeKind.TASK, "Task", "Task", true, container), "Task");
        register(new ShapeDescriptor(ShapeKind.COMPENSATION, "Compensation", "", true, container), "Compensation");
        register(new ShapeDescriptor(ShapeKind.ATOMIC_TRANSACTION, "AtomicTransaction", "", true, container),
                "AtomicTransaction");
        register(new ShapeDescriptor(ShapeKind.LONG_RUNNING_TRANSACTION, "LongRunningTransaction", "", true, container),
                "LongRunningTransaction");
    }

    private void register(ShapeDescriptor descriptor, String... types) {
        for (String type : types) {
            descriptors.put(type, descriptor);
        }
    }

    private ShapeBuilder expressionProperty() {
        return (el, node, ctx) -> new ShapePayload.Expression(reader.property(el, "Expression"));
    }

    private ShapePayload buildReceive(Element element, ShapeNode node, ParseContext context) {
        return new ShapePayload.Receive(
                reader.property(element, "PortName"),
                reader.property(element, "MessageName"),
                reader.property(element, "OperationName"),
                reader.property(element, "OperationMessageName"),
                "True".equalsIgnoreCase(reader.property(element, "Activate")),
                List.of(),
                List.of());
    }

    private ShapePayload buildSend(Element element, ShapeNode node, ParseContext context) {
        return new ShapePayload.Send(
                reader.property(element, "PortName"),
                reader.property(element, "MessageName"),
                reader.property(element, "OperationName"),
                reader.property(element, "OperationMessageName"));
    }

    private ShapePayload buildLoop(Element element, ShapeNode node, ParseContext context) {
        String collection = reader.eval(element,
                "om:Element[@Type='Expression']/om:Property[@Name='Expression']/@Value");
        if (collection.isBlank()) {
            collection = reader.property(element, "Expression");
        }
        String iterator = reader.eval(element,
                "om:Element[@Type='IteratorVariable']/om:Property[@Name='Name']/@Value");
        return new ShapePayload.Loop(collection, orDefault(iterator, "item"));
    }

    private ShapePayload buildConstruct(Element element, ShapeNode node, ParseContext context) {
        List<String> messages = new ArrayList<>();
        for (Element messageRef : reader.childElements(element, "MessageRef")) {
            String message = reader.property(messageRef, "Ref");
            if (!message.isEmpty()) {
                messages.add(message);
            }
        }

        ParseContext inner = subContext(context, node, "inner");
        List<Integer> innerShapes = new ArrayList<>();
        for (Element child : reader.childElements(element)) {
            if (!CONSTRUCT_INNER_TYPES.contains(reader.type(child))) {
                continue;
            }
            parseShape(child, inner, node.handle()).ifPresent(shape -> {
                tree.link(node.handle(), shape.handle());
                innerShapes.add(shape.handle());
            });
        }
        return new ShapePayload.Construct(messages, innerShapes);
    }

    private ShapePayload buildTransform(Element element, ShapeNode node, ParseContext context) {
        List<String> inputs = new ArrayList<>();
        for (Element partRef : reader.childElements(element, "MessagePartRef")) {
            String message = reader.property(partRef, "MessageRef");
            if (!message.isEmpty()) {
                inputs.add(message);
            }
        }
        // a two-reference transform is source then destination
        List<String> outputs = new ArrayList<>();
        if (inputs.size() == 2) {
            outputs.add(inputs.remove(1));
        }
        return new ShapePayload.Transform(reader.property(element, "ClassName"), inputs, outputs);
    }

    private ShapePayload buildCorrelationDeclaration(Element element, ShapeNode node, ParseContext context) {
        List<CorrelationReference> references = new ArrayList<>();
        for (Element statementRef : reader.childElements(element, "StatementRef")) {
            String ref = reader.property(statementRef, "Ref");
            if (!ref.isEmpty()) {
                references.add(new CorrelationReference(ref,
                        "True".equalsIgnoreCase(reader.property(statementRef, "Initializes"))));
            }
        }
        return new ShapePayload.CorrelationDeclaration(reader.property(element, "Type"), references);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    @FunctionalInterface
    interface ShapeBuilder {
        ShapePayload build(Element element, ShapeNode node, ParseContext context);
    }

    /**
     * @param shapeType type name the node is counted under; null keeps the element's own type
     * @param recursive whether generic children are parsed after the payload
     */
    private record ShapeDescriptor(
            ShapeKind kind,
            String shapeType,
            String defaultName,
            boolean recursive,
            ShapeBuilder builder
    ) {
    }
}
