package org.netcoord.runtime;

/**
 * Why a run reached {@link RunStatus#COMPLETED}.
 */
public enum CompletionReason {
    /** The step horizon was reached. */
    HORIZON_EXHAUSTED,
    /** A delegate reported {@code done}. */
    DELEGATE_DONE,
    /** {@link Orchestrator#cancel()} was honoured at a tick boundary. */
    CANCELLED
}
