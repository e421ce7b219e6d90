package org.shellsafe.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"        # PLAIN (message only) or DETAILED
 *   default-level = "WARN"  # level of the root logger
 *   levels {
 *     "org.shellsafe.cli" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** Context and system property read by {@code logback.xml} to pick the appender. */
    public static final String FORMAT_PROPERTY = "shellsafe.logging.format";

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";

    private LoggingConfigurator() {}

    /**
     * Applies the logging settings. Unknown level names fall back to {@code WARN}.
     * @param config The application configuration.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            log.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        Config logging = config.getConfig(LOGGING_CONFIG_PATH);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            String format = "DETAILED".equalsIgnoreCase(logging.getString("format")) ? "STDERR_DETAILED" : "STDERR_PLAIN";
            if (!format.equals(System.getProperty(FORMAT_PROPERTY, "STDERR_PLAIN"))) {
                System.setProperty(FORMAT_PROPERTY, format);
                reconfigure(context);
            }
        }
        if (logging.hasPath("default-level")) {
            Level level = Level.toLevel(logging.getString("default-level"), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                setLevel(entry.getKey(), entry.getValue().unwrapped().toString());
            }
        }
    }

    private static void reconfigure(LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Sets the level of one logger.
     * @param loggerName The logger name, usually a package.
     * @param levelName The level name.
     */
    public static void setLevel(String loggerName, String levelName) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level level = Level.toLevel(levelName, Level.WARN);
        context.getLogger(loggerName).setLevel(level);
        log.debug("Configured logger '{}' to level: {}", loggerName, level);
    }
}
