package org.kasd.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.kasd.compiler.diagnostics.LogLevel;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Configures Logback at runtime from the HOCON configuration and from the numeric log level.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.kasd.compiler.frontend.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 * The numeric level (0-4) controls the {@code org.kasd} logger.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    /** The logger whose level follows the numeric log level. */
    public static final String APPLICATION_LOGGER = "org.kasd";

    private LoggingConfigurator() {}

    /**
     * Applies the {@code logging} block of the configuration, if present.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    /**
     * Sets the level of the application logger from a numeric log level.
     * @param logLevel The log level.
     */
    public static void apply(final LogLevel logLevel) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(APPLICATION_LOGGER).setLevel(toLogbackLevel(logLevel));
    }

    /**
     * Maps a numeric log level to the Logback level.
     * @param logLevel The log level.
     * @return OFF, ERROR, WARN, INFO or DEBUG.
     */
    public static Level toLogbackLevel(final LogLevel logLevel) {
        return switch (logLevel) {
            case NONE -> Level.OFF;
            case ERROR -> Level.ERROR;
            case WARNING -> Level.WARN;
            case INFO -> Level.INFO;
            case DEBUG -> Level.DEBUG;
        };
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.WARN);

            final Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(level);

            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        for (final Map.Entry<String, com.typesafe.config.ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
    }
}
