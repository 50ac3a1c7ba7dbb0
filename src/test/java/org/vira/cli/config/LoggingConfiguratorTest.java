package org.vira.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private static Logger logback(String name) {
        return (Logger) LoggerFactory.getLogger(name);
    }

    @AfterEach
    void tearDown() {
        logback(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
        for (String name : new String[] {"quoted.logger", "nested.logger.name", "bad.level", "numeric.level"}) {
            logback(name).setLevel(null);
        }
    }

    @Test
    void appliesRootAndQuotedLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { level = ERROR, loggers { \"quoted.logger\" = DEBUG } }"));

        assertThat(logback(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(logback("quoted.logger").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void joinsNestedLoggerNames() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.loggers.nested.logger.name = TRACE"));

        assertThat(logback("nested.logger.name").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void skipsUnknownAndNonStringLevels() {
        logback("bad.level").setLevel(Level.INFO);

        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { level = LOUD, loggers { \"bad.level\" = LOUD, \"numeric.level\" = 5 } }"));

        assertThat(logback(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(logback("bad.level").getLevel()).isEqualTo(Level.INFO);
        assertThat(logback("numeric.level").getLevel()).isNull();
    }
}
