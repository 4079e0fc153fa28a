package org.netcoord.runtime.registry;

import org.netcoord.runtime.ConfigurationException;

/**
 * Thrown when a built-in alias (a name without a package) has not been registered.
 */
public class UnknownCapabilityException extends ConfigurationException {

    private final String name;

    public UnknownCapabilityException(String name) {
        super("Unknown capability '" + name + "'");
        this.name = name;
    }

    /**
     * @return The alias that could not be resolved.
     */
    public String getName() {
        return name;
    }
}
