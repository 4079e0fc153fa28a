package org.netcoord.runtime.registry;

import org.netcoord.runtime.ConfigurationException;

/**
 * Thrown when a qualified class reference cannot be located or instantiated, or when the
 * constructed instance does not provide the requested capability.
 */
public class ResolutionException extends ConfigurationException {

    private final String reference;

    public ResolutionException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public ResolutionException(String reference, String message, Throwable cause) {
        super(message, cause);
        this.reference = reference;
    }

    /**
     * @return The name or class reference whose resolution failed.
     */
    public String getReference() {
        return reference;
    }
}
