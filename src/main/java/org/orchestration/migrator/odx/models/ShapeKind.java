package org.orchestration.migrator.odx.models;

/**
 * Closed set of control-flow node kinds. The kind decides which {@link ShapePayload}
 * variant a node carries; the node's shape type string keeps the designer name
 * (e.g. a LOOP node may be a "Loop" or a "ForEach", a FALLBACK node keeps the unknown type).
 */
public enum ShapeKind {
    RECEIVE,
    SEND,
    CONSTRUCT,
    TRANSFORM,
    MESSAGE_ASSIGNMENT,
    VARIABLE_ASSIGNMENT,
    WHILE,
    UNTIL,
    LOOP,
    CALL,
    START_ORCHESTRATION,
    CORRELATION_DECLARATION,
    DECIDE,
    SWITCH,
    LISTEN,
    SCOPE,
    THROW,
    SUSPEND,
    TERMINATE,
    EXPRESSION,
    DELAY,
    COMPENSATE,
    GROUP,
    PARALLEL,
    PARALLEL_BRANCH,
    TASK,
    CATCH,
    COMPENSATION,
    ATOMIC_TRANSACTION,
    LONG_RUNNING_TRANSACTION,
    VARIABLE_DECLARATION,
    CALL_RULES,
    FALLBACK
}
