package org.netcoord.runtime.model;

import java.util.Objects;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Declares one fading model (keyed by channel id) or mobility model (keyed by agent id).
 *
 * @param targetId Channel id for fading models, agent id for mobility models.
 * @param reference Alias or class name of the model.
 * @param parameters Model parameters; empty when none are given.
 */
public record ModelSpec(String targetId, ModelReference reference, Config parameters) {

    public ModelSpec {
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(reference, "reference");
        parameters = parameters == null ? ConfigFactory.empty() : parameters;
    }

    public static ModelSpec of(String targetId, String reference, Config parameters) {
        return new ModelSpec(targetId, ModelReference.parse(reference), parameters);
    }
}
