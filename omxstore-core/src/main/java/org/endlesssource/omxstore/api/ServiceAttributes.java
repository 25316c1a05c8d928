package org.endlesssource.omxstore.api;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link OmxStore#listServiceAttributes()}.
 */
public record ServiceAttributes(Status status, List<Attribute> attributes) {
    public ServiceAttributes {
        Objects.requireNonNull(status, "status must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
