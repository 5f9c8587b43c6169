package org.kasd.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "kasd.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dkasd.log-level=4)
     * 2. Environment Variables
     * 3. Configuration File ({@code explicitFile}, or kasd.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a configuration file cannot be parsed.
     */
    public static Config load(final File explicitFile) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironment();

        final File configFile = explicitFile != null ? explicitFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
