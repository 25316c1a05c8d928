package org.endlesssource.omxstore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.OmxStoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads store configuration. Sources, highest precedence first:
 * <ol>
 *     <li>Java system properties ({@code -Domxstore.instances.vendor.prefix=...})</li>
 *     <li>the configuration file from the options, or {@code omxstore.conf} in the working directory</li>
 *     <li>the configuration resource from the options on the classpath</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * @throws OmxStoreConfigException if an explicit file is missing or a source cannot be parsed
     */
    public static Config load(OmxStoreOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        try {
            return loadLayers(options);
        } catch (ConfigException e) {
            throw new OmxStoreConfigException("Failed to load store configuration: " + e.getMessage(), e);
        }
    }

    private static Config loadLayers(OmxStoreOptions options) {
        Config fileConfig = options.getConfigFile()
                .map(ConfigLoader::parseRequiredFile)
                .orElseGet(() -> parseOptionalFile(Path.of(OmxStoreOptions.DEFAULT_CONFIG_RESOURCE)));

        logger.debug("Loading configuration resource {}", options.getConfigResource());
        Config resourceConfig = ConfigFactory.parseResources(options.getConfigResource());

        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(resourceConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    private static Config parseRequiredFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new OmxStoreConfigException("Configuration file not found: " + file.toAbsolutePath());
        }
        logger.info("Loading configuration from file: {}", file.toAbsolutePath());
        return ConfigFactory.parseFile(file.toFile());
    }

    private static Config parseOptionalFile(Path file) {
        if (!Files.isRegularFile(file)) {
            logger.debug("Configuration file {} not found, skipping", file.toAbsolutePath());
            return ConfigFactory.empty();
        }
        logger.info("Loading configuration from file: {}", file.toAbsolutePath());
        return ConfigFactory.parseFile(file.toFile());
    }
}
