package org.endlesssource.omxstore.store;

import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.Omx;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider handles by name. Handles are registered once; lookups never create one.
 */
public final class ProviderDirectory {
    private final Map<String, Omx> providers;

    private ProviderDirectory(Map<String, Omx> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name provider name
     * @return the handle, or null when nothing is registered under {@code name}
     */
    public Omx getOmx(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return providers.get(name);
    }

    public boolean contains(String name) {
        return providers.containsKey(name);
    }

    public List<String> providerNames() {
        return List.copyOf(providers.keySet());
    }

    public static final class Builder {
        private final Map<String, Omx> providers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Omx omx) {
            Objects.requireNonNull(omx, "omx must not be null");
            String name = Objects.requireNonNull(omx.getName(), "provider name must not be null");
            if (providers.putIfAbsent(name, omx) != null) {
                throw new OmxStoreConfigException("Duplicate provider: " + name);
            }
            return this;
        }

        public ProviderDirectory build() {
            return new ProviderDirectory(providers);
        }
    }
}
