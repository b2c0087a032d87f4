package org.localcompute.algebra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties
 * 2. Configuration File
 * 3. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class ConfigLoaderTest {

    private static final String TEST_CONFIG = "config/test-algebra.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("algebra.equivalence.trials");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load configuration file with defaults when no overrides present")
    void load_shouldLoadConfigFileWithDefaults() {
        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getInt("algebra.equivalence.trials")).isEqualTo(25);
        // not in the file, so reference.conf supplies it
        assertThat(config.getDouble("algebra.equivalence.tolerance")).isEqualTo(1e-9);
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        // Arrange
        System.setProperty("test.value", "system-value");
        System.setProperty("algebra.equivalence.trials", "30");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(TEST_CONFIG);

        // Assert
        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(EngineConfig.fromConfig(config).equivalenceTrials()).isEqualTo(30);
    }

    @Test
    @DisplayName("Missing configuration file falls back to reference defaults")
    void load_shouldHandleMissingConfigFile(@TempDir Path dir) {
        // Act
        Config config = ConfigLoader.load(dir.resolve("algebra.conf").toFile());

        // Assert
        assertThat(EngineConfig.fromConfig(config)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    @DisplayName("Should read a configuration file from disk")
    void load_shouldReadFile(@TempDir Path dir) throws IOException {
        // Arrange
        File file = dir.resolve("algebra.conf").toFile();
        Files.writeString(file.toPath(), "algebra.parser.max-nesting-depth = 12\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt("algebra.parser.max-nesting-depth")).isEqualTo(12);
        assertThat(config.getInt("algebra.suggestion.max-steps")).isEqualTo(50);
    }
}
