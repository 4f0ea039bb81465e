package org.mutagen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the pass configuration from its sources in a fixed precedence order.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "mutagen.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, highest precedence first:
     * 1. Environment variables
     * 2. JVM system properties (-Dkey=value)
     * 3. mutagen.conf in the working directory
     * 4. reference.conf on the classpath
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Same as {@link #load()} but reads the file layer from a classpath resource.
     *
     * @param resourceName The classpath resource to use instead of mutagen.conf.
     * @return The resolved configuration.
     */
    public static Config load(final String resourceName) {
        final Config resourceConfig = ConfigFactory.parseResourcesAnySyntax(resourceName);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration resource '{}' not found or is empty. Using defaults.", resourceName);
        }
        return merge(resourceConfig);
    }

    private static Config merge(final Config fileConfig) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
