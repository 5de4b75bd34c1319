package org.simlab.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from HOCON configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     # trace every draw of the generator
 *     "org.simlab.runtime.internal.services.RandomLCG" = "TRACE"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * Calling it more than once has no additional effect until {@link #reset()}.
     *
     * @param config The configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
                final String levelName = loggingConfig.getString(DEFAULT_LEVEL_KEY);
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring invalid default log level '{}'", levelName);
                } else {
                    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
                    LOGGER.debug("Configured default log level: {}", level);
                }
            }

            if (loggingConfig.hasPath(LEVELS_KEY)) {
                for (Map.Entry<String, Object> entry : loggingConfig.getConfig(LEVELS_KEY).root().unwrapped().entrySet()) {
                    final Level level = Level.toLevel(String.valueOf(entry.getValue()), null);
                    if (level == null) {
                        LOGGER.warn("Ignoring invalid log level '{}' for logger '{}'", entry.getValue(), entry.getKey());
                        continue;
                    }
                    context.getLogger(entry.getKey()).setLevel(level);
                    LOGGER.debug("Configured log level for {}: {}", entry.getKey(), level);
                }
            }
        } catch (final ConfigException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    /**
     * Allows {@link #configure(Config)} to apply a configuration again.
     */
    static synchronized void reset() {
        loggingConfigured = false;
    }
}
