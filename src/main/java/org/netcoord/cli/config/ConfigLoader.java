package org.netcoord.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the netcoord configuration for the command line.
 * <p>
 * Layers, highest precedence first: JVM system properties, environment variables, the scenario
 * file, {@code reference.conf}. Substitutions are resolved only after all layers are stacked, so
 * a scenario file can override values that {@code reference.conf} refers to.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "netcoord.conf";

    private ConfigLoader() {
    }

    /** Severity of a discovery message. */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the scenario file and loads it. The first match wins:
     * <ol>
     *   <li>the file given with {@code --config},</li>
     *   <li>the file named by {@code -Dconfig.file},</li>
     *   <li>{@code config/netcoord.conf} below the working directory,</li>
     *   <li>{@code config/netcoord.conf} below the installation directory (the parent of the
     *       directory holding the netcoord jar),</li>
     *   <li>classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile File from {@code --config}, or {@code null}.
     * @param handler Receives discovery messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "--config");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            File propertyFile = new File(propertyPath).getAbsoluteFile();
            requireExists(propertyFile, "-Dconfig.file");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + propertyFile);
            return loadFromFile(propertyFile);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        File installedFile = findInstalledConfigFile();
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using installed configuration file " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found; running with classpath defaults only");
        return loadDefaults();
    }

    /**
     * Stacks system properties, environment and {@code configFile} over {@code reference.conf}.
     */
    public static Config loadFromFile(File configFile) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Stacks system properties and environment over {@code reference.conf}.
     */
    public static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }

    private static void requireExists(File file, String source) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file given via " + source + " not found: " + file.getAbsolutePath());
        }
    }

    private static File findInstalledConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        File location;
        try {
            URL url = codeSource.getLocation();
            location = new File(url.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        // APP_HOME/lib/netcoord.jar -> APP_HOME; a classes directory has no installation layout
        if (!location.isFile() || location.getParentFile() == null) {
            return null;
        }
        File appHome = location.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
