package org.rpncompiler.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.rpncompiler.toolchain" = "INFO"
 *   }
 * }
 * </pre>
 *
 * Levels are applied once per process; {@link #reset()} restores the levels that were
 * in place before and allows another {@link #configure(Config)}.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final Map<String, Level> previousLevels = new HashMap<>();
    private static boolean applied = false;

    private LoggingConfigurator() {}

    /**
     * Applies the configured levels unless that already happened.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            LOG.debug("No logging block configured, keeping logback.xml levels");
            return;
        }
        levelsFrom(config.getConfig("logging")).forEach(LoggingConfigurator::setLevel);
    }

    /**
     * Overrides the level of a single logger, e.g. for a command line verbosity flag.
     *
     * @param loggerName The logger to change.
     * @param level The new level.
     */
    public static synchronized void setLevel(final String loggerName, final Level level) {
        final ch.qos.logback.classic.Logger logger = context().getLogger(loggerName);
        previousLevels.putIfAbsent(loggerName, logger.getLevel());
        logger.setLevel(level);
        LOG.debug("Logger '{}' set to {}", loggerName, level);
    }

    /**
     * Restores all levels changed through this class and forgets that logging was configured.
     */
    public static synchronized void reset() {
        final LoggerContext context = context();
        previousLevels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        previousLevels.clear();
        applied = false;
    }

    private static Map<String, Level> levelsFrom(final Config logging) {
        final Map<String, Level> levels = new LinkedHashMap<>();
        if (logging.hasPath("default-level")) {
            levels.put(Logger.ROOT_LOGGER_NAME, Level.toLevel(logging.getString("default-level"), Level.WARN));
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                final String name = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(name, null);
                if (level == null) {
                    LOG.warn("Ignoring unknown level '{}' for logger '{}'", name, entry.getKey());
                } else {
                    levels.put(entry.getKey(), level);
                }
            }
        }
        return levels;
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
