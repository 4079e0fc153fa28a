package org.netcoord.runtime;

/**
 * Orchestrator lifecycle: {@code IDLE -> RUNNING -> {COMPLETED, ABORTED}}.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
