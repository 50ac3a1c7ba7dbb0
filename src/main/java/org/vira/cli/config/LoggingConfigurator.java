package org.vira.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code logging} section of the configuration to Logback.
 * <pre>
 * logging {
 *   level = "WARN"
 *   loggers {
 *     "org.vira.compiler.frontend.preprocessor" = "DEBUG"
 *   }
 * }
 * </pre>
 * Unquoted logger names such as {@code -Dlogging.loggers.org.vira=DEBUG} nest in HOCON; they are
 * joined back into the dotted logger name. Values that are not a known level are skipped with a warning.
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @param config The resolved application config.
     */
    public static void configure(Config config) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            apply(context, Logger.ROOT_LOGGER_NAME, config.getValue("logging.level"));
        }
        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.loggers").entrySet()) {
                String name = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                apply(context, name, entry.getValue());
            }
        }
    }

    private static void apply(LoggerContext context, String loggerName, ConfigValue value) {
        Level level = value.valueType() == ConfigValueType.STRING
                ? Level.toLevel((String) value.unwrapped(), null)
                : null;
        if (level == null) {
            log.warn("Ignoring log level '{}' for logger '{}' ({})",
                    value.unwrapped(), loggerName, value.origin().description());
            return;
        }
        context.getLogger(loggerName).setLevel(level);
    }
}
