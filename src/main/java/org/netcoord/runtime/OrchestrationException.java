package org.netcoord.runtime;

/**
 * Base class for every failure raised by the orchestration core.
 * <p>
 * All subclasses are unchecked: configuration and delegate failures invalidate the run and are
 * not recoverable by the caller, while per-agent proposal failures never escape the coordinator.
 */
public class OrchestrationException extends RuntimeException {

    /**
     * Creates an OrchestrationException with the specified message.
     *
     * @param message Description of the failure
     */
    public OrchestrationException(String message) {
        super(message);
    }

    /**
     * Creates an OrchestrationException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception
     */
    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
