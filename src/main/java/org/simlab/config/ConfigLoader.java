package org.simlab.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the simulation configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE_NAME = "simlab.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration from {@value #DEFAULT_CONFIG_FILE_NAME}.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     * @see #load(String)
     */
    public static Config load() {
        return load(DEFAULT_CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System properties (e.g., -Drandom.seed=42)
     * 2. The named configuration file, looked up in the working directory first and then on the classpath
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configName File path or classpath resource name of the configuration.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configName) {
        final Config cliConfig = ConfigFactory.systemProperties();

        final File configFile = new File(configName);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configName);
        }
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configName);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return cliConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
