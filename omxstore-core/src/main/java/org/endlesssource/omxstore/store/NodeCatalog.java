package org.endlesssource.omxstore.store;

import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.NodeInfo;
import org.endlesssource.omxstore.api.RoleInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registered roles and their nodes in preference order.
 * <p>
 * All node names are checked against the {@link PrefixPolicy} when a role is
 * added, so {@link #listRoles()} returns the registered data as is.
 */
public final class NodeCatalog {
    private final PrefixPolicy prefixPolicy;
    private final List<RoleInfo> roles;

    private NodeCatalog(PrefixPolicy prefixPolicy, List<RoleInfo> roles) {
        this.prefixPolicy = prefixPolicy;
        this.roles = List.copyOf(roles);
    }

    public static Builder builder(PrefixPolicy prefixPolicy) {
        return new Builder(prefixPolicy);
    }

    public PrefixPolicy getPrefixPolicy() {
        return prefixPolicy;
    }

    public List<RoleInfo> listRoles() {
        return roles;
    }

    /**
     * Owners referenced by any node, each mapped to the first node naming it.
     */
    Map<String, String> ownerReferences() {
        Map<String, String> owners = new LinkedHashMap<>();
        for (RoleInfo role : roles) {
            for (NodeInfo node : role.nodes()) {
                owners.putIfAbsent(node.owner(), node.name());
            }
        }
        return Collections.unmodifiableMap(owners);
    }

    public static final class Builder {
        private final PrefixPolicy prefixPolicy;
        private final Set<String> roleNames = new LinkedHashSet<>();
        private final List<RoleInfo> roles = new ArrayList<>();

        private Builder(PrefixPolicy prefixPolicy) {
            this.prefixPolicy = Objects.requireNonNull(prefixPolicy, "prefixPolicy must not be null");
        }

        /**
         * Register a role.
         * @throws OmxStoreConfigException if the role is already registered, a node name misses
         *         the prefix, a node occurs twice in the role, or a node repeats an attribute key
         */
        public Builder addRole(RoleInfo role) {
            Objects.requireNonNull(role, "role must not be null");
            if (roleNames.contains(role.role())) {
                throw new OmxStoreConfigException("Duplicate role: " + role.role());
            }
            Set<String> nodeNames = new HashSet<>();
            for (NodeInfo node : role.nodes()) {
                if (!prefixPolicy.matches(node.name())) {
                    throw new OmxStoreConfigException("Node '" + node.name() + "' of role " + role.role()
                            + " does not start with prefix '" + prefixPolicy.getNodePrefix() + "'");
                }
                if (!nodeNames.add(node.name())) {
                    throw new OmxStoreConfigException("Duplicate node '" + node.name() + "' in role " + role.role());
                }
                AttributeStore.requireUniqueKeys(node.attributes(), "node " + node.name());
            }
            roleNames.add(role.role());
            roles.add(role);
            return this;
        }

        public NodeCatalog build() {
            return new NodeCatalog(prefixPolicy, roles);
        }
    }
}
