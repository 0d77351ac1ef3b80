package org.sandpile.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configures the application's logging system based on HOCON configuration.
 * This class reads logging settings from the configuration and applies them
 * to the Logback logging framework at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # Can be "PLAIN" or "KEYVALUE". Defaults to PLAIN
 *   default-level = "INFO"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.sandpile.runtime.ToppleEngine" = "TRACE"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /**
     * Property read by {@code logback.xml} to pick the console appender.
     */
    public static final String FORMAT_PROPERTY = "sandpile.logging.format";

    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
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

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied successfully.");
    }

    /**
     * Selects the console appender. Logback only reads the property while parsing its
     * configuration, so a change reloads it.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = appenderFor(format);
        if (appender.equals(context.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);
        reloadLogback(context);
        context.putProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format);
    }

    /**
     * Maps a configured format name to the appender defined in {@code logback.xml}.
     *
     * @param format {@code PLAIN} or {@code KEYVALUE}, case-insensitive; anything else selects PLAIN.
     * @return The appender name.
     */
    static String appenderFor(final String format) {
        return "KEYVALUE".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
    }

    private static void reloadLogback(final LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback-test.xml");
        if (configUrl == null) {
            configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        }
        if (configUrl == null) {
            return;
        }
        // Turbo filters added programmatically would be lost by the reset.
        final List<TurboFilter> turboFilters = new ArrayList<>(context.getTurboFilterList());
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration from {}, keeping defaults.", configUrl, e);
        }
        for (final TurboFilter filter : turboFilters) {
            filter.start();
            context.addTurboFilter(filter);
        }
    }

    /**
     * Configures the default log level for all loggers.
     */
    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    /**
     * Configures specific logger levels as defined in the configuration.
     */
    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
