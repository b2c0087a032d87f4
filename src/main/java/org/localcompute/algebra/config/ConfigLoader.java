package org.localcompute.algebra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the engine configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "algebra.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dalgebra.equivalence.trials=20)
     * 3. Configuration File (algebra.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit configuration file in place of {@code algebra.conf}.
     *
     * @param configFile The configuration file; skipped when it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the configuration file.
     *
     * @param resourcePath The classpath resource, e.g. {@code config/test-algebra.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourcePath) {
        LOG.debug("Loading configuration from classpath resource: {}", resourcePath);
        return layer(ConfigFactory.parseResources(resourcePath));
    }

    private static Config layer(final Config fileConfig) {
        // Environment variables win, then -D system properties, then the file, then reference.conf.
        final Config combinedConfig = ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"));

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
