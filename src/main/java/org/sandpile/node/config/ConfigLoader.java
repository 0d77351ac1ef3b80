package org.sandpile.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import com.typesafe.config.ConfigValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * The configuration file picked up from the working directory when no file is given explicitly.
     */
    public static final String CONFIG_FILE_NAME = "sandpile.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dsandpile.simulation.grid-size=50)
     * 2. Environment Variables
     * 3. Configuration File (the explicit file, or sandpile.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if the explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(explicitFile.getPath()),
                        "Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Using configuration file found in current directory: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration from a classpath resource instead of the filesystem,
     * with the same precedence as {@link #load(File)}.
     *
     * @param resource The resource name, e.g. {@code "test-config.conf"}.
     * @return The resolved configuration.
     */
    public static Config loadResource(final String resource) {
        return layer(ConfigFactory.parseResources(resource));
    }

    /**
     * Applies explicit overrides, e.g. from command-line options, on top of a loaded configuration.
     *
     * @param base The loaded configuration.
     * @param overrides Values keyed by full path; {@code null} values are skipped.
     * @return The merged and resolved configuration.
     */
    public static Config withOverrides(final Config base, final Map<String, ?> overrides) {
        Config result = base;
        for (final Map.Entry<String, ?> entry : overrides.entrySet()) {
            if (entry.getValue() != null) {
                LOG.debug("Overriding '{}' with {}", entry.getKey(), entry.getValue());
                result = result.withValue(entry.getKey(), ConfigValueFactory.fromAnyRef(entry.getValue(), "command line"));
            }
        }
        return result.resolve();
    }

    private static Config layer(final Config fileConfig) {
        // System properties are cached by Typesafe Config; pick up changes made since the last load.
        ConfigFactory.invalidateCaches();
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
