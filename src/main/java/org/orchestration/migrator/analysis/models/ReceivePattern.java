package org.orchestration.migrator.analysis.models;

/**
 * How the activating receives of an orchestration map onto a single-trigger workflow.
 */
public enum ReceivePattern {
    /** No activating receive; the workflow is started by a request trigger. */
    CALLABLE,
    SINGLE_TRIGGER,
    /** One activating receive initializing a correlation that later receives follow. */
    CONVOY,
    /** Several activating receives inside one Listen; the first message wins. */
    LISTEN_FIRST_TO_COMPLETE,
    /** Several activating receives in parallel branches; cannot be mapped to one trigger. */
    PARALLEL_ALL_MUST_COMPLETE,
    /** Several sequential activating receives; cannot be mapped to one trigger. */
    INVALID
}
