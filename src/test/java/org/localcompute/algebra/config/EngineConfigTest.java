package org.localcompute.algebra.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EngineConfigTest {

    @Test
    @Tag("unit")
    void testDefaults() {
        // Act
        EngineConfig config = EngineConfig.defaults();

        // Assert
        assertThat(config.maxNestingDepth()).isEqualTo(200);
        assertThat(config.equivalenceTrials()).isEqualTo(10);
        assertThat(config.equivalenceTolerance()).isEqualTo(1e-9);
        assertThat(config.equivalenceSeed()).isEqualTo(738201L);
        assertThat(config.attemptsFactor()).isEqualTo(4);
        assertThat(config.sampleMin()).isEqualTo(0.3);
        assertThat(config.sampleMax()).isEqualTo(2.7);
        assertThat(config.maxSimplificationSteps()).isEqualTo(50);
    }

    @Test
    @Tag("unit")
    void testFileOverridesDefaults() {
        // Act
        EngineConfig config = EngineConfig.fromConfig(ConfigLoader.load("config/test-algebra.conf"));

        // Assert
        assertThat(config.equivalenceTrials()).isEqualTo(25);
        assertThat(config.equivalenceSeed()).isEqualTo(42L);
        assertThat(config.maxSimplificationSteps()).isEqualTo(7);
        assertThat(config.maxNestingDepth()).isEqualTo(200);
    }

    @Test
    @Tag("unit")
    void testWithers() {
        // Act
        EngineConfig config = EngineConfig.defaults().withEquivalenceTrials(20).withEquivalenceSeed(7);

        // Assert
        assertThat(config.equivalenceTrials()).isEqualTo(20);
        assertThat(config.equivalenceSeed()).isEqualTo(7L);
        assertThat(config.equivalenceTolerance()).isEqualTo(EngineConfig.defaults().equivalenceTolerance());
    }

    /**
     * Invalid settings are rejected when the configuration is read, not when a check runs.
     */
    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> EngineConfig.defaults().withEquivalenceTrials(4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 5");
        assertThatThrownBy(() -> EngineConfig.fromConfig(ConfigFactory.parseString("algebra.equivalence.tolerance = 0")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.fromConfig(ConfigFactory.parseString(
                        "algebra.equivalence { sample-min = 2, sample-max = 1 }")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sample range");
        assertThatThrownBy(() -> new EngineConfig(0, 10, 1e-9, 1, 4, 0.3, 2.7, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
