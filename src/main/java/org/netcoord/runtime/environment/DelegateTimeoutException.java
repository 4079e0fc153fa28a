package org.netcoord.runtime.environment;

import java.time.Duration;

import org.netcoord.runtime.OrchestrationException;

/**
 * Thrown when a delegate's step overruns its configured per-call deadline.
 * Always fatal, regardless of the delegate's failure policy.
 */
public class DelegateTimeoutException extends OrchestrationException {

    private final String delegateName;
    private final long stepIndex;
    private final Duration deadline;

    public DelegateTimeoutException(String delegateName, long stepIndex, Duration deadline) {
        super(String.format("Delegate '%s' did not finish step %d within %d ms",
                delegateName, stepIndex, deadline.toMillis()));
        this.delegateName = delegateName;
        this.stepIndex = stepIndex;
        this.deadline = deadline;
    }

    public String getDelegateName() {
        return delegateName;
    }

    public long getStepIndex() {
        return stepIndex;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
