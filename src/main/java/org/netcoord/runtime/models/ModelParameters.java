package org.netcoord.runtime.models;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Reads and validates numeric model parameters, reporting problems as
 * {@link InvalidModelParametersException}.
 */
public final class ModelParameters {

    private ModelParameters() {
    }

    /**
     * @throws InvalidModelParametersException if the key is missing or not a number.
     */
    public static double requireDouble(Config parameters, String model, String key) {
        if (!parameters.hasPath(key)) {
            throw new InvalidModelParametersException(model + " requires parameter '" + key + "'");
        }
        return readDouble(parameters, model, key);
    }

    /**
     * @throws InvalidModelParametersException if the key is present but not a number.
     */
    public static double optionalDouble(Config parameters, String model, String key, double fallback) {
        return parameters.hasPath(key) ? readDouble(parameters, model, key) : fallback;
    }

    public static double requirePositive(String model, String key, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new InvalidModelParametersException(
                    String.format("%s parameter '%s' must be > 0 (got %s)", model, key, value));
        }
        return value;
    }

    public static double requireNonNegative(String model, String key, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidModelParametersException(
                    String.format("%s parameter '%s' must be >= 0 (got %s)", model, key, value));
        }
        return value;
    }

    private static double readDouble(Config parameters, String model, String key) {
        try {
            return parameters.getDouble(key);
        } catch (ConfigException.WrongType e) {
            throw new InvalidModelParametersException(
                    model + " parameter '" + key + "' must be a number", e);
        }
    }
}
