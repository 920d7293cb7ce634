package org.xenon.lax.cli.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Unit tests for {@link LoggingConfigurator}.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        context.getLogger("org.xenon.lax").setLevel(Level.WARN);
        context.getLogger("org.duckdb").setLevel(Level.WARN);
        context.getLogger("com.example.nested").setLevel(null);
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
    }

    @Test
    void configure_AppliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.default-level = ERROR\n"
                + "logging.levels { \"org.duckdb\" = DEBUG, com.example.nested = TRACE }"));

        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.duckdb").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("com.example.nested").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void enableVerbose_SetsApplicationLoggersToDebug() {
        LoggingConfigurator.enableVerbose();

        assertThat(context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }
}
