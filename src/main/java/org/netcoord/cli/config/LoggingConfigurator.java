package org.netcoord.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from {@code netcoord.logging}:
 * <pre>
 * netcoord.logging {
 *   default-level = INFO
 *   levels { "org.netcoord.runtime.coordination" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("netcoord.logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("netcoord.logging.default-level"), Level.INFO));
        }
        if (config.hasPath("netcoord.logging.levels")) {
            Config levels = config.getConfig("netcoord.logging.levels");
            for (Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }
}
