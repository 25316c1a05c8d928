package org.endlesssource.omxstore.store;

import org.endlesssource.omxstore.OmxStoreConfigException;

import java.util.Objects;

/**
 * The node name prefix of one store deployment.
 */
public final class PrefixPolicy {
    private final String prefix;

    private PrefixPolicy(String prefix) {
        this.prefix = prefix;
    }

    public static PrefixPolicy of(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (prefix.isEmpty()) {
            throw new OmxStoreConfigException("Node prefix must not be empty");
        }
        return new PrefixPolicy(prefix);
    }

    public String getNodePrefix() {
        return prefix;
    }

    public boolean matches(String nodeName) {
        return nodeName != null && nodeName.startsWith(prefix);
    }

    @Override
    public String toString() {
        return "PrefixPolicy[" + prefix + "]";
    }
}
