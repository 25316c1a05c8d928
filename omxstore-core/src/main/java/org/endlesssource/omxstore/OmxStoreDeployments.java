package org.endlesssource.omxstore;

import org.endlesssource.omxstore.api.OmxStore;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Store deployments running side by side, selected by instance name.
 */
public final class OmxStoreDeployments {
    public static final String PLATFORM = "platform";
    public static final String VENDOR = "vendor";
    public static final List<String> STANDARD_INSTANCES = List.of(PLATFORM, VENDOR);

    private final Map<String, OmxStore> stores;

    OmxStoreDeployments(Collection<OmxStore> stores) {
        Map<String, OmxStore> byName = new LinkedHashMap<>();
        for (OmxStore store : stores) {
            OmxStore previous = byName.putIfAbsent(store.getInstanceName(), store);
            if (previous != null) {
                throw new OmxStoreConfigException("Duplicate store instance: " + store.getInstanceName());
            }
        }
        this.stores = Collections.unmodifiableMap(byName);
    }

    /**
     * Group already built stores by instance name.
     * @throws OmxStoreConfigException if two stores share an instance name
     */
    public static OmxStoreDeployments of(Collection<OmxStore> stores) {
        Objects.requireNonNull(stores, "stores must not be null");
        return new OmxStoreDeployments(stores);
    }

    /**
     * Find a deployment by instance name
     * @param instanceName e.g. {@link #PLATFORM} or {@link #VENDOR}
     * @return The store, or empty if no deployment has that name
     */
    public Optional<OmxStore> get(String instanceName) {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        return Optional.ofNullable(stores.get(instanceName));
    }

    public OmxStore platform() {
        return require(PLATFORM);
    }

    public OmxStore vendor() {
        return require(VENDOR);
    }

    public Set<String> instanceNames() {
        return stores.keySet();
    }

    public Collection<OmxStore> all() {
        return stores.values();
    }

    private OmxStore require(String instanceName) {
        return get(instanceName).orElseThrow(() ->
                new IllegalStateException("No store deployment named " + instanceName));
    }
}
