package org.netcoord.runtime.models;

/**
 * Thrown when a model parameter is missing, mistyped or outside its domain
 * (for example a Nakagami {@code m_factor <= 0}).
 */
public class InvalidModelParametersException extends ModelResolutionException {

    public InvalidModelParametersException(String message) {
        super(message);
    }

    public InvalidModelParametersException(String message, Throwable cause) {
        super(message, cause);
    }
}
