package org.netcoord.runtime.models;

import org.netcoord.runtime.ConfigurationException;

/**
 * Thrown when a fading or mobility model specification cannot be turned into a model instance.
 */
public class ModelResolutionException extends ConfigurationException {

    public ModelResolutionException(String message) {
        super(message);
    }

    public ModelResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
