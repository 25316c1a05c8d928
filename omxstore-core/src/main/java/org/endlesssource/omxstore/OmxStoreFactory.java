package org.endlesssource.omxstore;

import com.typesafe.config.Config;
import org.endlesssource.omxstore.api.Omx;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.OmxStoreOptions;
import org.endlesssource.omxstore.config.ConfigLoader;
import org.endlesssource.omxstore.config.DeploymentConfigReader;
import org.endlesssource.omxstore.spi.OmxProvider;
import org.endlesssource.omxstore.store.ProviderDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class OmxStoreFactory {
    private static final Logger logger = LoggerFactory.getLogger(OmxStoreFactory.class);

    private OmxStoreFactory() {}

    /**
     * Create one store deployment from the default configuration sources
     * @param instanceName Deployment name, e.g. "platform"
     * @return The loaded store
     * @throws OmxStoreConfigException if the deployment cannot be assembled
     */
    public static OmxStore create(String instanceName) {
        return create(instanceName, OmxStoreOptions.defaults());
    }

    /**
     * Create one store deployment
     * @param instanceName Deployment name, e.g. "platform"
     * @param options Configuration sources and provider handles
     * @return The loaded store
     * @throws OmxStoreConfigException if the deployment cannot be assembled
     */
    public static OmxStore create(String instanceName, OmxStoreOptions options) {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return create(instanceName, ConfigLoader.load(options), options);
    }

    /**
     * Create one store deployment from an already loaded configuration
     * @throws OmxStoreConfigException if the deployment cannot be assembled
     */
    public static OmxStore create(String instanceName, Config config, OmxStoreOptions options) {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(options, "options must not be null");
        logger.debug("Creating store {}", instanceName);
        return DeploymentConfigReader.read(instanceName, config, openProviders(options));
    }

    /**
     * Create the standard "platform" and "vendor" deployments side by side
     * @throws OmxStoreConfigException if either deployment cannot be assembled
     */
    public static OmxStoreDeployments createDeployments() {
        return createDeployments(OmxStoreOptions.defaults());
    }

    /**
     * Create the standard "platform" and "vendor" deployments side by side
     * @param options Configuration sources and provider handles, shared by both deployments
     * @throws OmxStoreConfigException if either deployment cannot be assembled
     */
    public static OmxStoreDeployments createDeployments(OmxStoreOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Config config = ConfigLoader.load(options);
        ProviderDirectory providers = openProviders(options);
        List<OmxStore> stores = new ArrayList<>();
        for (String instanceName : OmxStoreDeployments.STANDARD_INSTANCES) {
            stores.add(DeploymentConfigReader.read(instanceName, config, providers));
        }
        return new OmxStoreDeployments(stores);
    }

    /**
     * Get provider names found on the classpath.
     */
    public static List<String> getDiscoveredProviders() {
        return loadProviders().stream()
                .map(OmxProvider::providerName)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get provider names that are runtime-available right now.
     */
    public static List<String> getAvailableProviders() {
        return loadProviders().stream()
                .map(OmxProvider::probeSupport)
                .filter(ProviderSupport::available)
                .map(ProviderSupport::provider)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static ProviderDirectory openProviders(OmxStoreOptions options) {
        if (!options.isProviderDiscoveryEnabled()) {
            return openProviders(options, List.of());
        }
        return openProviders(options, loadProviders());
    }

    /**
     * Register the explicit handles from {@code options}, then probe and open {@code discovered}
     * when discovery is enabled.
     */
    static ProviderDirectory openProviders(OmxStoreOptions options, List<OmxProvider> discovered) {
        ProviderDirectory.Builder directory = ProviderDirectory.builder();
        for (Omx omx : options.getProviders()) {
            directory.register(omx);
        }
        if (!options.isProviderDiscoveryEnabled()) {
            return directory.build();
        }

        List<OmxProvider> providers = discovered.stream()
                .sorted(Comparator.comparing(OmxProvider::providerName))
                .toList();
        for (OmxProvider provider : providers) {
            ProviderSupport support = provider.probeSupport();
            if (!support.available()) {
                logger.warn("Skipping provider {}: {}", provider.providerName(), support.reason());
                continue;
            }
            directory.register(open(provider));
        }
        return directory.build();
    }

    private static Omx open(OmxProvider provider) {
        Omx omx;
        try {
            omx = provider.open();
        } catch (RuntimeException e) {
            throw new OmxStoreConfigException("Failed to open provider " + provider.providerName()
                    + ": " + e.getMessage(), e);
        }
        if (omx == null || !provider.providerName().equals(omx.getName())) {
            throw new OmxStoreConfigException("Provider " + provider.providerName()
                    + " returned a handle named " + (omx == null ? null : omx.getName()));
        }
        logger.debug("Opened provider {}", provider.providerName());
        return omx;
    }

    private static List<OmxProvider> loadProviders() {
        ServiceLoader<OmxProvider> loader = ServiceLoader.load(OmxProvider.class);
        List<OmxProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered node providers: {}",
                    providers.stream().map(OmxProvider::providerName).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
