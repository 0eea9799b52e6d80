package org.orchestration.migrator.odx.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-kind data of a {@link ShapeNode}. The shared header (OID, name, kind, sequence,
 * parent and generic children) lives on the node; everything a kind adds lives here.
 * Branch and case lists hold node handles of the owning {@link ShapeTree}. Every list and
 * map is copied on construction and cannot be modified afterwards.
 */
public sealed interface ShapePayload {

    /**
     * Receive shape. The correlation pass replaces the payload with {@link #withCorrelationSet}.
     */
    record Receive(
            String portName,
            String messageName,
            String operationName,
            String operationMessageName,
            boolean activate,
            List<String> initializesCorrelationSets,
            List<String> followsCorrelationSets
    ) implements ShapePayload {
        public Receive {
            initializesCorrelationSets = List.copyOf(initializesCorrelationSets);
            followsCorrelationSets = List.copyOf(followsCorrelationSets);
        }

        /**
         * @param correlationSet name of the correlation set
         * @param initializes    true to add it to the initialized sets, false to the followed ones
         * @return a copy with the set appended, or this payload if it is already listed
         */
        public Receive withCorrelationSet(String correlationSet, boolean initializes) {
            List<String> current = initializes ? initializesCorrelationSets : followsCorrelationSets;
            if (current.contains(correlationSet)) {
                return this;
            }
            List<String> extended = new ArrayList<>(current);
            extended.add(correlationSet);
            return new Receive(portName, messageName, operationName, operationMessageName, activate,
                    initializes ? extended : initializesCorrelationSets,
                    initializes ? followsCorrelationSets : extended);
        }
    }

    record Send(
            String portName,
            String messageName,
            String operationName,
            String operationMessageName
    ) implements ShapePayload {
    }

    /**
     * @param constructedMessages messages built by the construct block
     * @param innerShapes         handles of the nested Transform / MessageAssignment nodes
     */
    record Construct(List<String> constructedMessages, List<Integer> innerShapes) implements ShapePayload {
        public Construct {
            constructedMessages = List.copyOf(constructedMessages);
            innerShapes = List.copyOf(innerShapes);
        }
    }

    record Transform(String className, List<String> inputMessages, List<String> outputMessages) implements ShapePayload {
        public Transform {
            inputMessages = List.copyOf(inputMessages);
            outputMessages = List.copyOf(outputMessages);
        }
    }

    /**
     * Expression-only payload shared by MessageAssignment, VariableAssignment, While,
     * Until, Expression and Delay nodes.
     */
    record Expression(String expression) implements ShapePayload {
    }

    record Loop(String collectionExpression, String iteratorVariable) implements ShapePayload {
    }

    /**
     * Call and StartOrchestration.
     */
    record Invoke(String invokee) implements ShapePayload {
    }

    record CorrelationDeclaration(String correlationType, List<CorrelationReference> statementReferences) implements ShapePayload {
        public CorrelationDeclaration {
            statementReferences = List.copyOf(statementReferences);
        }
    }

    record Decide(String condition, List<Integer> trueBranch, List<Integer> falseBranch) implements ShapePayload {
        public Decide {
            trueBranch = List.copyOf(trueBranch);
            falseBranch = List.copyOf(falseBranch);
        }
    }

    /**
     * @param cases       case key to the concatenated shapes of every case container with that key, in document order
     * @param defaultCase shapes of the default case containers
     */
    record Switch(String discriminant, Map<String, List<Integer>> cases, List<Integer> defaultCase) implements ShapePayload {
        public Switch {
            // keeps case order, which Map.copyOf would not
            Map<String, List<Integer>> copied = new LinkedHashMap<>();
            cases.forEach((key, handles) -> copied.put(key, List.copyOf(handles)));
            cases = Collections.unmodifiableMap(copied);
            defaultCase = List.copyOf(defaultCase);
        }
    }

    /**
     * One list per branch container, in document order.
     */
    record Listen(List<List<Integer>> branches) implements ShapePayload {
        public Listen {
            List<List<Integer>> copied = new ArrayList<>(branches.size());
            for (List<Integer> branch : branches) {
                copied.add(List.copyOf(branch));
            }
            branches = Collections.unmodifiableList(copied);
        }
    }

    /**
     * Throw, Suspend and Terminate.
     */
    record Terminate(String errorMessage) implements ShapePayload {
    }

    record Compensate(String target) implements ShapePayload {
    }

    record Catch(String exceptionType, String exceptionVariable) implements ShapePayload {
    }

    record VariableDeclaration(String variableType, boolean useDefaultConstructor) implements ShapePayload {
    }

    record CallRules(String policyName) implements ShapePayload {
    }

    /**
     * Structural containers without data of their own: Scope, Group, Parallel,
     * ParallelBranch, Task, Compensation and the transaction scopes.
     */
    record Container() implements ShapePayload {
    }

    record Fallback(String rawType, String details) implements ShapePayload {
    }
}
