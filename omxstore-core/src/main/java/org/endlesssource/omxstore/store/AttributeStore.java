package org.endlesssource.omxstore.store;

import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.Attribute;
import org.endlesssource.omxstore.api.ServiceAttributes;
import org.endlesssource.omxstore.api.Status;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Service-wide attributes of one store deployment, fixed at startup.
 */
public final class AttributeStore {
    private final ServiceAttributes snapshot;

    private AttributeStore(ServiceAttributes snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * @param attributes attributes in configured order
     * @throws OmxStoreConfigException if a key occurs more than once
     */
    public static AttributeStore of(List<Attribute> attributes) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        requireUniqueKeys(attributes, "service attributes");
        return new AttributeStore(new ServiceAttributes(Status.OK, attributes));
    }

    public static AttributeStore empty() {
        return of(List.of());
    }

    public ServiceAttributes listServiceAttributes() {
        return snapshot;
    }

    static void requireUniqueKeys(List<Attribute> attributes, String context) {
        Set<String> seen = new HashSet<>();
        for (Attribute attribute : attributes) {
            Objects.requireNonNull(attribute, "attribute must not be null");
            if (!seen.add(attribute.key())) {
                throw new OmxStoreConfigException("Duplicate attribute key '" + attribute.key() + "' in " + context);
            }
        }
    }
}
