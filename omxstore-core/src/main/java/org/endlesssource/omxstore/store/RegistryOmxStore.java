package org.endlesssource.omxstore.store;

import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.Omx;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.RoleInfo;
import org.endlesssource.omxstore.api.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link OmxStore} over an attribute store, a node catalog and a provider directory.
 * Every node owner is checked against the directory when the store is assembled.
 */
public final class RegistryOmxStore implements OmxStore {
    private static final Logger logger = LoggerFactory.getLogger(RegistryOmxStore.class);

    private final String instanceName;
    private final AttributeStore attributes;
    private final NodeCatalog catalog;
    private final ProviderDirectory providers;

    private RegistryOmxStore(String instanceName,
                             AttributeStore attributes,
                             NodeCatalog catalog,
                             ProviderDirectory providers) {
        this.instanceName = instanceName;
        this.attributes = attributes;
        this.catalog = catalog;
        this.providers = providers;
    }

    /**
     * Assemble a store deployment.
     * @throws OmxStoreConfigException if a node owner is not registered in {@code providers}
     */
    public static RegistryOmxStore assemble(String instanceName,
                                            AttributeStore attributes,
                                            NodeCatalog catalog,
                                            ProviderDirectory providers) {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(providers, "providers must not be null");

        List<String> dangling = new ArrayList<>();
        for (Map.Entry<String, String> reference : catalog.ownerReferences().entrySet()) {
            if (!providers.contains(reference.getKey())) {
                dangling.add(reference.getKey() + " (node " + reference.getValue() + ")");
            }
        }
        if (!dangling.isEmpty()) {
            throw new OmxStoreConfigException("Store " + instanceName + " references unknown providers: "
                    + String.join(", ", dangling) + "; registered: " + providers.providerNames());
        }

        RegistryOmxStore store = new RegistryOmxStore(instanceName, attributes, catalog, providers);
        logger.info("Loaded store {} with prefix {}: {} roles, {} service attributes, providers {}",
                instanceName, catalog.getPrefixPolicy().getNodePrefix(), catalog.listRoles().size(),
                attributes.listServiceAttributes().attributes().size(), providers.providerNames());
        return store;
    }

    @Override
    public String getInstanceName() {
        return instanceName;
    }

    @Override
    public ServiceAttributes listServiceAttributes() {
        return attributes.listServiceAttributes();
    }

    @Override
    public String getNodePrefix() {
        return catalog.getPrefixPolicy().getNodePrefix();
    }

    @Override
    public List<RoleInfo> listRoles() {
        return catalog.listRoles();
    }

    @Override
    public Omx getOmx(String name) {
        return providers.getOmx(name);
    }

    @Override
    public String toString() {
        return "RegistryOmxStore[" + instanceName + "]";
    }
}
