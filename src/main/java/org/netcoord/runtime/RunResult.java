package org.netcoord.runtime;

/**
 * Completion signal of a run.
 *
 * @param status {@link RunStatus#COMPLETED} or {@link RunStatus#ABORTED}.
 * @param reason Completion reason, {@code null} for aborted runs.
 * @param stepsExecuted Ticks fully executed (history length).
 * @param error The fatal error of an aborted run, {@code null} otherwise.
 */
public record RunResult(RunStatus status, CompletionReason reason, long stepsExecuted, Throwable error) {

    public static RunResult completed(CompletionReason reason, long stepsExecuted) {
        return new RunResult(RunStatus.COMPLETED, reason, stepsExecuted, null);
    }

    public static RunResult aborted(Throwable error, long stepsExecuted) {
        return new RunResult(RunStatus.ABORTED, null, stepsExecuted, error);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
