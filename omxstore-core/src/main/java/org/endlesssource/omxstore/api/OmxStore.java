package org.endlesssource.omxstore.api;

import java.util.List;

/**
 * Read-only view of one deployment of the codec capability registry.
 * All operations are side-effect free and safe to call concurrently.
 */
public interface OmxStore {

    /**
     * Get the deployment name of this store
     * @return Instance name, e.g. "platform" or "vendor"
     */
    String getInstanceName();

    /**
     * List service-wide attributes
     * @return Status and the configured attributes in insertion order
     */
    ServiceAttributes listServiceAttributes();

    /**
     * Get the prefix every node name of this store starts with
     * @return The configured node prefix
     */
    String getNodePrefix();

    /**
     * List all registered roles with their nodes
     * @return Roles in configured order, each with nodes in preference order
     */
    List<RoleInfo> listRoles();

    /**
     * Look up a node provider by name
     * @param name Provider name as found in {@link NodeInfo#owner()}
     * @return The provider handle, or null if no provider is registered under that name
     */
    Omx getOmx(String name);
}
