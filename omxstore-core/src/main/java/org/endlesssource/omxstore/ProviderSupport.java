package org.endlesssource.omxstore;

import java.util.Objects;

/**
 * Runtime availability of a node provider.
 */
public record ProviderSupport(String provider, boolean available, String reason) {
    public ProviderSupport {
        Objects.requireNonNull(provider, "provider must not be null");
        reason = reason == null ? "" : reason;
    }

    public static ProviderSupport available(String provider) {
        return new ProviderSupport(provider, true, "");
    }

    public static ProviderSupport unavailable(String provider, String reason) {
        return new ProviderSupport(provider, false, reason);
    }
}
