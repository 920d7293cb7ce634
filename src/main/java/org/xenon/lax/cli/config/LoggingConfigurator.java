package org.xenon.lax.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from configuration to the Logback context.
 * <p>
 * Reads {@code logging.default-level} (root logger) and the {@code logging.levels} map of
 * logger name to level. Unknown level names fall back to INFO (Logback's behavior).
 */
public final class LoggingConfigurator {

    /** Logger hierarchy switched to DEBUG by {@code --verbose}. */
    public static final String APPLICATION_LOGGER = "org.xenon.lax";

    private LoggingConfigurator() {
    }

    /**
     * @param config the resolved application configuration
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                // "org.xenon.lax" = DEBUG and org.xenon.lax = DEBUG name the same logger
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }

    /**
     * Sets the application loggers to DEBUG, overriding configured levels.
     */
    public static void enableVerbose() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
        }
    }
}
