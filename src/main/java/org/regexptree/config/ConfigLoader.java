package org.regexptree.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the library configuration from its layered sources.
 * The first source that defines a key wins.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "regexptree.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java system properties (e.g., -Dregexptree.minimum-host-version=5.008)
     * 2. Configuration file (regexptree.conf in the working directory)
     * 3. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the working directory file.
     *
     * @param resourceName The classpath resource to read, e.g. {@code org/regexptree/config/test-settings.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        LOG.debug("Loading configuration from classpath resource: {}", resourceName);
        return layer(ConfigFactory.parseResources(resourceName));
    }

    private static Config layer(final Config fileConfig) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources(ConfigLoader.class, "/reference.conf");

        // The one provided first wins.
        return cliConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
