package org.netcoord.runtime.environment;

/**
 * Lifecycle of a delegate within one episode.
 * <pre>
 *   ACTIVE --(step returns done)--> DONE --(next step)--> HELD
 *   ACTIVE --(step throws, SKIP policy)--> SKIPPED
 * </pre>
 * Only {@link #ACTIVE} delegates invoke their simulator; all other states replay the last
 * transition. {@code reset} returns every state to {@link #ACTIVE}.
 */
public enum DelegateState {
    /** Stepping normally. */
    ACTIVE,
    /** Produced its final transition on the latest step. */
    DONE,
    /** Finished earlier; its last transition is being replayed. */
    HELD,
    /** Failed under {@link DelegateFailurePolicy#SKIP}; its last good transition is being replayed. */
    SKIPPED
}
