package org.stockflow.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the logger levels in {@code stockflow.logging.levels} to Logback.
 *
 * <p>Keys are logger names, values are level names. Quoted and unquoted keys are both
 * accepted: {@code "org.stockflow.runtime" = DEBUG} and {@code org.stockflow.runtime = DEBUG}
 * name the same logger.</p>
 */
public final class LoggingConfigurator {

    static final String LEVELS_PATH = "stockflow.logging.levels";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Config levels = config.getConfig(LEVELS_PATH);
        for (Map.Entry<String, ConfigValue> entry : levels.entrySet()) {
            String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Logger logger = "ROOT".equalsIgnoreCase(loggerName)
                    ? context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    : context.getLogger(loggerName);
            logger.setLevel(Level.toLevel(levelName, Level.INFO));
        }
    }
}
