package org.endlesssource.omxstore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.Attribute;
import org.endlesssource.omxstore.api.ComponentRoles;
import org.endlesssource.omxstore.api.NodeInfo;
import org.endlesssource.omxstore.api.RoleInfo;
import org.endlesssource.omxstore.store.AttributeStore;
import org.endlesssource.omxstore.store.NodeCatalog;
import org.endlesssource.omxstore.store.PrefixPolicy;
import org.endlesssource.omxstore.store.ProviderDirectory;
import org.endlesssource.omxstore.store.RegistryOmxStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a store deployment from its {@code omxstore.instances.<name>} block.
 */
public final class DeploymentConfigReader {
    public static final String INSTANCES_PATH = "omxstore.instances";

    private DeploymentConfigReader() {
    }

    /**
     * @param instanceName deployment to read
     * @param config resolved configuration root
     * @param providers provider handles available to the deployment
     * @throws OmxStoreConfigException if the block is missing or malformed, or violates a store invariant
     */
    public static RegistryOmxStore read(String instanceName, Config config, ProviderDirectory providers) {
        Objects.requireNonNull(instanceName, "instanceName must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(providers, "providers must not be null");

        String path = INSTANCES_PATH + "." + instanceName;
        if (!config.hasPath(path)) {
            throw new OmxStoreConfigException("No configuration for store instance " + instanceName + " at " + path);
        }
        try {
            Config instance = config.getConfig(path);
            PrefixPolicy prefix = PrefixPolicy.of(instance.getString("prefix"));
            AttributeStore attributes = AttributeStore.of(readAttributes(instance));

            NodeCatalog.Builder catalog = NodeCatalog.builder(prefix);
            if (instance.hasPath("roles")) {
                for (Config role : instance.getConfigList("roles")) {
                    catalog.addRole(readRole(role));
                }
            }
            return RegistryOmxStore.assemble(instanceName, attributes, catalog.build(), providers);
        } catch (ConfigException | OmxStoreConfigException e) {
            throw new OmxStoreConfigException("Invalid configuration for store instance "
                    + instanceName + ": " + e.getMessage(), e);
        }
    }

    private static RoleInfo readRole(Config role) {
        String type = role.getString("type");
        boolean isEncoder = role.getBoolean("is-encoder");
        String name;
        if (role.hasPath("role")) {
            name = role.getString("role");
        } else {
            name = ComponentRoles.roleFor(type, isEncoder).orElseThrow(() -> new OmxStoreConfigException(
                    "No standard role for type " + type + "; set 'role' explicitly"));
        }
        boolean preferPlatformNodes = !role.hasPath("prefer-platform-nodes") || role.getBoolean("prefer-platform-nodes");

        List<NodeInfo> nodes = new ArrayList<>();
        if (role.hasPath("nodes")) {
            for (Config node : role.getConfigList("nodes")) {
                nodes.add(new NodeInfo(node.getString("name"), node.getString("owner"), readAttributes(node)));
            }
        }
        return new RoleInfo(name, type, isEncoder, preferPlatformNodes, nodes);
    }

    private static List<Attribute> readAttributes(Config parent) {
        if (!parent.hasPath("attributes")) {
            return List.of();
        }
        List<Attribute> attributes = new ArrayList<>();
        for (Config attribute : parent.getConfigList("attributes")) {
            attributes.add(new Attribute(attribute.getString("key"), attribute.getString("value")));
        }
        return attributes;
    }
}
