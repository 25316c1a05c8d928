package org.endlesssource.omxstore.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options used when building {@link OmxStore} deployments.
 */
public final class OmxStoreOptions {
    public static final String DEFAULT_CONFIG_RESOURCE = "omxstore.conf";

    private final Path configFile;
    private final String configResource;
    private final boolean providerDiscoveryEnabled;
    private final List<Omx> providers;

    private OmxStoreOptions(Path configFile,
                            String configResource,
                            boolean providerDiscoveryEnabled,
                            List<Omx> providers) {
        this.configFile = configFile;
        this.configResource = requireNonBlank("configResource", configResource);
        this.providerDiscoveryEnabled = providerDiscoveryEnabled;
        this.providers = List.copyOf(providers);
    }

    public static OmxStoreOptions defaults() {
        return new OmxStoreOptions(null, DEFAULT_CONFIG_RESOURCE, true, List.of());
    }

    /**
     * Explicit configuration file, layered above the classpath resource.
     */
    public Optional<Path> getConfigFile() {
        return Optional.ofNullable(configFile);
    }

    public String getConfigResource() {
        return configResource;
    }

    public boolean isProviderDiscoveryEnabled() {
        return providerDiscoveryEnabled;
    }

    /**
     * Provider handles registered in addition to the discovered ones.
     */
    public List<Omx> getProviders() {
        return providers;
    }

    public OmxStoreOptions withConfigFile(Path file) {
        Objects.requireNonNull(file, "configFile must not be null");
        return new OmxStoreOptions(file, configResource, providerDiscoveryEnabled, providers);
    }

    public OmxStoreOptions withConfigResource(String resource) {
        return new OmxStoreOptions(configFile, resource, providerDiscoveryEnabled, providers);
    }

    public OmxStoreOptions withProviderDiscovery(boolean enabled) {
        return new OmxStoreOptions(configFile, configResource, enabled, providers);
    }

    public OmxStoreOptions withProvider(Omx provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        List<Omx> extended = new ArrayList<>(providers);
        extended.add(provider);
        return new OmxStoreOptions(configFile, configResource, providerDiscoveryEnabled, extended);
    }

    private static String requireNonBlank(String name, String value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
