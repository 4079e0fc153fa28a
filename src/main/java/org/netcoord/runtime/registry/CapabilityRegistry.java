package org.netcoord.runtime.registry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.spi.IAgent;
import org.netcoord.runtime.spi.ICapabilityFactory;
import org.netcoord.runtime.spi.IRandomProvider;
import org.netcoord.runtime.spi.ITool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Build context holding named capability factories (simulators, agents, models, tools) and the
 * instances resolved from them.
 * <p>
 * A name is either an alias registered through {@link #register(String, ICapabilityFactory)} or a
 * fully-qualified class name, which is located reflectively on first use. {@link #resolve(String)}
 * constructs at most one instance per name for the lifetime of the registry; concurrent callers
 * may read the cache freely, while the first resolution of a given name holds a per-name lock.
 * <p>
 * A registry is created per scenario and passed explicitly to every construction step; there is
 * no process-wide instance.
 */
public class CapabilityRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final IRandomProvider randomProvider;
    private final Map<String, ICapabilityFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, Object> instances = new ConcurrentHashMap<>();
    private final Map<String, Object> resolutionLocks = new ConcurrentHashMap<>();
    private final List<String> agentIds = new CopyOnWriteArrayList<>();

    /**
     * @param randomProvider Parent provider; each constructed instance receives a stream derived
     *                       from it for its name.
     */
    public CapabilityRegistry(IRandomProvider randomProvider) {
        this.randomProvider = randomProvider;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    /**
     * Registers a named factory.
     *
     * @param name Alias or id; must be unique within the registry.
     * @param factory Factory building the capability.
     * @throws ConfigurationException if the name is already registered.
     */
    public void register(String name, ICapabilityFactory factory) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Capability name must not be blank");
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new ConfigurationException("Capability '" + name + "' is already registered");
        }
        LOG.debug("Registered capability '{}'", name);
    }

    /**
     * Registers a pre-built instance under a name. {@link #resolve(String)} returns it as is.
     */
    public void registerInstance(String name, Object instance) {
        register(name, (random, options) -> instance);
        instances.put(name, instance);
    }

    /**
     * Registers an agent factory. Agents are enumerated by {@link #listAgents()} in registration
     * order.
     */
    public void registerAgent(String agentId, ICapabilityFactory factory) {
        register(agentId, factory);
        agentIds.add(agentId);
    }

    /**
     * Registers a pre-built agent under its own id.
     */
    public void registerAgent(IAgent agent) {
        registerInstance(agent.id(), agent);
        agentIds.add(agent.id());
    }

    /**
     * @return Agent ids in registration order; stable for the lifetime of a run.
     */
    public List<String> listAgents() {
        return List.copyOf(agentIds);
    }

    /**
     * Returns the factory for a name, locating and caching it for class names.
     *
     * @param nameOrReference Alias or fully-qualified class name.
     * @return The factory.
     * @throws UnknownCapabilityException if an alias is not registered.
     * @throws ResolutionException if a class name cannot be located.
     */
    public ICapabilityFactory locate(String nameOrReference) {
        ICapabilityFactory factory = factories.get(nameOrReference);
        if (factory != null) {
            return factory;
        }
        if (!isQualified(nameOrReference)) {
            throw new UnknownCapabilityException(nameOrReference);
        }
        synchronized (lockFor(nameOrReference)) {
            factory = factories.get(nameOrReference);
            if (factory == null) {
                factory = ReflectiveCapabilityFactory.forClassName(nameOrReference);
                factories.put(nameOrReference, factory);
                LOG.debug("Located capability class {}", nameOrReference);
            }
            return factory;
        }
    }

    /**
     * Resolves a capability to its cached instance, constructing it with empty options on first
     * use.
     *
     * @param nameOrReference Alias or fully-qualified class name.
     * @return The instance shared by every caller using the same string.
     */
    public Object resolve(String nameOrReference) {
        Object cached = instances.get(nameOrReference);
        if (cached != null) {
            return cached;
        }
        ICapabilityFactory factory = locate(nameOrReference);
        synchronized (lockFor(nameOrReference)) {
            cached = instances.get(nameOrReference);
            if (cached != null) {
                return cached;
            }
            Object instance = construct(nameOrReference, factory,
                    randomProvider.deriveFor(nameOrReference, 0), ConfigFactory.empty());
            instances.put(nameOrReference, instance);
            return instance;
        }
    }

    /**
     * Typed variant of {@link #resolve(String)}.
     *
     * @throws ResolutionException if the instance is not a {@code type}.
     */
    public <T> T resolve(String nameOrReference, Class<T> type) {
        return requireType(nameOrReference, resolve(nameOrReference), type);
    }

    /**
     * Builds a fresh, uncached instance with explicit options.
     *
     * @param nameOrReference Alias or fully-qualified class name.
     * @param random Random provider for the new instance.
     * @param options Constructor options.
     * @param type Required capability type.
     * @return The new instance.
     */
    public <T> T create(String nameOrReference, IRandomProvider random, Config options, Class<T> type) {
        ICapabilityFactory factory = locate(nameOrReference);
        return requireType(nameOrReference, construct(nameOrReference, factory, random, options), type);
    }

    /**
     * Resolves a registered agent.
     */
    public IAgent agent(String agentId) {
        return resolve(agentId, IAgent.class);
    }

    /**
     * Resolves a tool by alias or class name.
     *
     * @throws ResolutionException if the capability is not an {@link ITool}.
     */
    public ITool tool(String nameOrReference) {
        return resolve(nameOrReference, ITool.class);
    }

    static boolean isQualified(String nameOrReference) {
        return nameOrReference != null && nameOrReference.indexOf('.') > 0;
    }

    private Object lockFor(String name) {
        return resolutionLocks.computeIfAbsent(name, k -> new Object());
    }

    private static Object construct(String name, ICapabilityFactory factory, IRandomProvider random, Config options) {
        try {
            Object instance = factory.create(random, options == null ? ConfigFactory.empty() : options);
            if (instance == null) {
                throw new ResolutionException(name, "Factory for '" + name + "' returned null");
            }
            return instance;
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new ResolutionException(name,
                    "Failed to construct capability '" + name + "': " + e.getMessage(), e);
        }
    }

    private static <T> T requireType(String name, Object instance, Class<T> type) {
        if (!type.isInstance(instance)) {
            throw new ResolutionException(name, String.format("Capability '%s' is a %s, not a %s",
                    name, instance.getClass().getName(), type.getSimpleName()));
        }
        return type.cast(instance);
    }
}
