package org.netcoord.runtime.environment;

import org.netcoord.runtime.OrchestrationException;

/**
 * Thrown when a wrapped simulator fails inside {@code step} or {@code reset}.
 * <p>
 * Carries the delegate name and the delegate-local step index so the failure can be
 * reproduced. Under {@link DelegateFailurePolicy#FAIL} it aborts the run.
 */
public class DelegateStepException extends OrchestrationException {

    private final String delegateName;
    private final long stepIndex;

    public DelegateStepException(String delegateName, long stepIndex, Throwable cause) {
        this(delegateName, stepIndex,
                String.format("Delegate '%s' failed at step %d: %s", delegateName, stepIndex,
                        cause == null ? "unknown cause" : cause.getMessage()),
                cause);
    }

    protected DelegateStepException(String delegateName, long stepIndex, String message, Throwable cause) {
        super(message, cause);
        this.delegateName = delegateName;
        this.stepIndex = stepIndex;
    }

    public String getDelegateName() {
        return delegateName;
    }

    public long getStepIndex() {
        return stepIndex;
    }
}
