package org.endlesssource.omxstore.api;

import java.util.List;
import java.util.Objects;

/**
 * A codec role and the nodes able to fulfil it.
 * <p>
 * {@code nodes} is in preference order: callers pick the first node whose
 * capabilities satisfy them, unless their own policy for
 * {@code preferPlatformNodes} says otherwise.
 */
public record RoleInfo(String role, String type, boolean isEncoder, boolean preferPlatformNodes,
                       List<NodeInfo> nodes) {
    public RoleInfo {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(type, "type must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
