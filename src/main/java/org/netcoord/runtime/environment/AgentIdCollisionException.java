package org.netcoord.runtime.environment;

import java.util.Set;

import org.netcoord.runtime.ConfigurationException;

/**
 * Thrown at build time when two delegates claim the same agent id.
 */
public class AgentIdCollisionException extends ConfigurationException {

    private final Set<String> collidingIds;

    public AgentIdCollisionException(String firstDelegate, String secondDelegate, Set<String> collidingIds) {
        super(String.format("Delegates '%s' and '%s' both declare agent ids %s",
                firstDelegate, secondDelegate, collidingIds));
        this.collidingIds = Set.copyOf(collidingIds);
    }

    public Set<String> getCollidingIds() {
        return collidingIds;
    }
}
