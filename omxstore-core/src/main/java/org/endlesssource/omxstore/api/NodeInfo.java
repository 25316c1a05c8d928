package org.endlesssource.omxstore.api;

import java.util.List;
import java.util.Objects;

/**
 * A concrete codec node as advertised by the store.
 *
 * @param name node name, passed verbatim to the owning provider to instantiate the node
 * @param owner name of the provider that owns the node, resolvable through {@link OmxStore#getOmx(String)}
 * @param attributes node capabilities in configured order
 */
public record NodeInfo(String name, String owner, List<Attribute> attributes) {
    public NodeInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
