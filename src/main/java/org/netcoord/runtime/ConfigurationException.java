package org.netcoord.runtime;

/**
 * Thrown at build time when a scenario cannot be assembled.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Unknown capability alias or unloadable class name</li>
 *   <li>Missing or out-of-domain model parameters</li>
 *   <li>Agent ids shared by more than one delegate</li>
 *   <li>Malformed scenario configuration</li>
 * </ul>
 * A configuration failure is never recoverable and aborts the run before any step executes.
 */
public class ConfigurationException extends OrchestrationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
