package org.localcompute.algebra.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.localcompute.algebra.junit.extensions.logging.AllowLog;
import org.localcompute.algebra.junit.extensions.logging.LogLevel;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
public class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.localcompute.algebra.sample";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(LOGGER_NAME).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void testSpecificLevelsAreApplied() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = WARN, levels { \"" + LOGGER_NAME + "\" = DEBUG } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void testConfigureIsIdempotent() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER_NAME + "\" = ERROR }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER_NAME + "\" = DEBUG }"));

        // Assert
        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @Tag("unit")
    @AllowLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD'.*")
    void testUnknownLevelIsSkipped() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER_NAME + "\" = LOUD }"));

        // Assert
        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isNull();
    }
}
