package org.procsim.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration section to Logback:
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.procsim.node.persistence" = "DEBUG"
 *   }
 * }
 * </pre>
 * Unknown level names fall back to INFO, as Logback does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }
}
