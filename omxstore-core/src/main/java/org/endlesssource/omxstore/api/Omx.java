package org.endlesssource.omxstore.api;

import java.util.List;

/**
 * Live handle to a node provider. Node allocation and connection management
 * belong to the provider and are not part of this interface.
 */
public interface Omx {

    /**
     * Get the provider name
     * @return Name under which the provider is registered (e.g. "software-omx")
     */
    String getName();

    /**
     * List the nodes this provider can instantiate
     * @return Node names, in the provider's own order
     */
    List<String> listNodes();
}
