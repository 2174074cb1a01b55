package org.promoharvest.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the layered application configuration. Precedence, highest first:
 * <ol>
 *   <li>system properties ({@code -Dpipeline.ingest.options.maxPerMinute=10})</li>
 *   <li>environment variables</li>
 *   <li>the given file, or {@code promoharvest.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "promoharvest.conf";

    private ConfigLoader() {
    }

    /**
     * @param configFile explicit file, or {@code null} to look for {@value #CONFIG_FILE_NAME}
     * @throws IllegalArgumentException if an explicit file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or substitutions do not resolve
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File cwdConfig = new File(CONFIG_FILE_NAME);
            if (cwdConfig.isFile()) {
                LOG.debug("Loading configuration from {}", cwdConfig.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfig);
            } else {
                LOG.debug("No '{}' in working directory, using classpath defaults", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }
        return loadWith(fileConfig);
    }

    /**
     * Loads a configuration from a classpath resource layered over {@code reference.conf}.
     */
    public static Config loadResource(final String resourceName) {
        return loadWith(ConfigFactory.parseResources(resourceName));
    }

    private static Config loadWith(final Config fileConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
