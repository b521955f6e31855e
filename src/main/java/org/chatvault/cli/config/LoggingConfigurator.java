package org.chatvault.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} section of the configuration to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "org.chatvault.archive.chunk" = "DEBUG" }
 * }
 * </pre>
 * Logger names containing dots must be quoted, otherwise HOCON reads them as nested paths.
 * Unknown level names fall back to INFO.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                final Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }
}
