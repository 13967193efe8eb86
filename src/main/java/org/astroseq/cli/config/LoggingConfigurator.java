package org.astroseq.cli.config;

import java.util.List;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the {@code logging.levels} block of the configuration to Logback.
 * <p>
 * Keys are logger names, either quoted ({@code "org.astroseq.engine" = DEBUG}) or nested.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Config levels = config.getConfig("logging.levels");
        for (Map.Entry<String, ConfigValue> entry : levels.entrySet()) {
            String loggerName = loggerName(entry.getKey());
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                throw new IllegalArgumentException(
                        "Invalid log level '" + levelName + "' for logger '" + loggerName + "'");
            }
            Logger logger = "ROOT".equalsIgnoreCase(loggerName)
                    ? context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    : context.getLogger(loggerName);
            logger.setLevel(level);
        }
    }

    static String loggerName(String path) {
        List<String> parts = ConfigUtil.splitPath(path);
        return String.join(".", parts);
    }
}
