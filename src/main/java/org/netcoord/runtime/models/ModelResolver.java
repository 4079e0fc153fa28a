package org.netcoord.runtime.models;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.model.ModelReference;
import org.netcoord.runtime.model.ModelSpec;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.registry.ResolutionException;
import org.netcoord.runtime.spi.ICapabilityFactory;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IMobilityModel;
import org.netcoord.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link ModelSpec}s into fading and mobility model instances.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>Built-in alias ({@code rician}, {@code rayleigh}, {@code nakagami}, {@code random_walk}).</li>
 *   <li>Fully-qualified class name, located through the {@link CapabilityRegistry} and required
 *       to implement the requested capability interface.</li>
 * </ol>
 * Every resolved model receives its own random stream, derived from the spec's kind, target id
 * and reference. Resolving the same spec twice therefore yields models of the same family with the
 * same parameters that produce the same sample sequence.
 */
public class ModelResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ModelResolver.class);

    private static final Map<String, ICapabilityFactory> FADING_ALIASES = Map.of(
            RicianFadingModel.ALIAS, RicianFadingModel::new,
            RayleighFadingModel.ALIAS, RayleighFadingModel::new,
            NakagamiFadingModel.ALIAS, NakagamiFadingModel::new);

    private static final Map<String, ICapabilityFactory> MOBILITY_ALIASES = Map.of(
            RandomWalkMobility.ALIAS, RandomWalkMobility::new);

    private enum Kind {
        FADING("fading", "channel"),
        MOBILITY("mobility", "agent");

        private final String label;
        private final String target;

        Kind(String label, String target) {
            this.label = label;
            this.target = target;
        }
    }

    private final CapabilityRegistry registry;
    private final IRandomProvider random;

    public ModelResolver(CapabilityRegistry registry) {
        this.registry = registry;
        this.random = registry.getRandomProvider().deriveFor("models", 0);
    }

    /**
     * @param spec Fading spec keyed by channel id.
     * @return A ready-to-sample model.
     * @throws ModelResolutionException if the reference is unknown or not a fading model.
     * @throws InvalidModelParametersException if parameters are missing or out of domain.
     */
    public IFadingModel resolveFading(ModelSpec spec) {
        return resolve(spec, Kind.FADING, FADING_ALIASES, MOBILITY_ALIASES, IFadingModel.class);
    }

    /**
     * @param spec Mobility spec keyed by agent id.
     * @return A ready-to-advance model.
     * @throws ModelResolutionException if the reference is unknown or not a mobility model.
     * @throws InvalidModelParametersException if parameters are missing or out of domain.
     */
    public IMobilityModel resolveMobility(ModelSpec spec) {
        return resolve(spec, Kind.MOBILITY, MOBILITY_ALIASES, FADING_ALIASES, IMobilityModel.class);
    }

    /**
     * Resolves a list of fading overrides into one model per channel. A later spec for the same
     * channel replaces the earlier one.
     *
     * @return Models keyed by channel id, in first-declaration order.
     */
    public Map<String, IFadingModel> resolveFadingOverrides(List<ModelSpec> specs) {
        return resolveOverrides(specs, Kind.FADING, this::resolveFading);
    }

    /**
     * Resolves a list of mobility overrides into one model per agent (last wins).
     *
     * @return Models keyed by agent id, in first-declaration order.
     */
    public Map<String, IMobilityModel> resolveMobilityOverrides(List<ModelSpec> specs) {
        return resolveOverrides(specs, Kind.MOBILITY, this::resolveMobility);
    }

    private <T> Map<String, T> resolveOverrides(List<ModelSpec> specs, Kind kind, Function<ModelSpec, T> resolver) {
        Map<String, T> models = new LinkedHashMap<>();
        for (ModelSpec spec : specs) {
            T previous = models.put(spec.targetId(), resolver.apply(spec));
            if (previous != null) {
                LOG.debug("{} model for {} '{}' replaced by {}", kind.label, kind.target,
                        spec.targetId(), spec.reference().value());
            }
        }
        return models;
    }

    private <T> T resolve(ModelSpec spec, Kind kind, Map<String, ICapabilityFactory> aliases,
                          Map<String, ICapabilityFactory> otherAliases, Class<T> type) {
        ModelReference reference = spec.reference();
        IRandomProvider stream = random.deriveFor(
                kind.label + ":" + spec.targetId() + ":" + reference.value(), 0);
        String context = String.format("%s model for %s '%s'", kind.label, kind.target, spec.targetId());

        if (reference instanceof ModelReference.BuiltinAlias alias) {
            ICapabilityFactory factory = aliases.get(alias.name());
            if (factory == null) {
                if (otherAliases.containsKey(alias.name())) {
                    throw new ModelResolutionException(String.format(
                            "%s: '%s' is not a %s model", context, alias.name(), kind.label));
                }
                throw new ModelResolutionException(String.format(
                        "%s: unknown alias '%s'", context, alias.name()));
            }
            return type.cast(build(context, factory, stream, spec));
        }

        ModelReference.QualifiedReference qualified = (ModelReference.QualifiedReference) reference;
        try {
            return registry.create(qualified.className(), stream, spec.parameters(), type);
        } catch (InvalidModelParametersException e) {
            throw new InvalidModelParametersException(context + ": " + e.getMessage(), e);
        } catch (ResolutionException e) {
            throw new ModelResolutionException(context + ": " + e.getMessage(), e);
        }
    }

    private static Object build(String context, ICapabilityFactory factory, IRandomProvider stream, ModelSpec spec) {
        try {
            return factory.create(stream, spec.parameters());
        } catch (InvalidModelParametersException e) {
            throw new InvalidModelParametersException(context + ": " + e.getMessage(), e);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelResolutionException(context + ": " + e.getMessage(), e);
        }
    }
}
