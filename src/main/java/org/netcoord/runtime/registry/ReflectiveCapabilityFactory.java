package org.netcoord.runtime.registry;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.spi.ICapabilityFactory;
import org.netcoord.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Factory for capabilities referenced by fully-qualified class name.
 * <p>
 * The class is loaded once, when the factory is located. Public constructors are tried in the
 * order {@code (IRandomProvider, Config)}, {@code (Config)}, {@code ()}; the first one present is
 * used for every instance.
 */
final class ReflectiveCapabilityFactory implements ICapabilityFactory {

    private enum Signature { RANDOM_AND_OPTIONS, OPTIONS, NO_ARGS }

    private final String className;
    private final Constructor<?> constructor;
    private final Signature signature;

    private ReflectiveCapabilityFactory(String className, Constructor<?> constructor, Signature signature) {
        this.className = className;
        this.constructor = constructor;
        this.signature = signature;
    }

    /**
     * Loads {@code className} and selects its construction signature.
     *
     * @param className Fully-qualified class name.
     * @return The factory.
     * @throws ResolutionException if the class cannot be loaded, is abstract, or has none of the
     *                             supported public constructors.
     */
    static ReflectiveCapabilityFactory forClassName(String className) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ResolutionException(className, "Class not found: " + className, e);
        }
        if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
            throw new ResolutionException(className, "Class " + className + " is not instantiable");
        }

        Constructor<?> ctor = findConstructor(clazz, IRandomProvider.class, Config.class);
        if (ctor != null) {
            return new ReflectiveCapabilityFactory(className, ctor, Signature.RANDOM_AND_OPTIONS);
        }
        ctor = findConstructor(clazz, Config.class);
        if (ctor != null) {
            return new ReflectiveCapabilityFactory(className, ctor, Signature.OPTIONS);
        }
        ctor = findConstructor(clazz);
        if (ctor != null) {
            return new ReflectiveCapabilityFactory(className, ctor, Signature.NO_ARGS);
        }
        throw new ResolutionException(className, "Class " + className
                + " has no public constructor (IRandomProvider, Config), (Config) or ()");
    }

    @Override
    public Object create(IRandomProvider random, Config options) throws Exception {
        try {
            return switch (signature) {
                case RANDOM_AND_OPTIONS -> constructor.newInstance(random, options);
                case OPTIONS -> constructor.newInstance(options);
                case NO_ARGS -> constructor.newInstance();
            };
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigurationException configurationException) {
                throw configurationException;
            }
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new ResolutionException(className, "Constructor of " + className + " failed", cause);
        }
    }

    private static Constructor<?> findConstructor(Class<?> clazz, Class<?>... parameterTypes) {
        try {
            return clazz.getConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
