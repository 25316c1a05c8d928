package org.endlesssource.omxstore.api;

import java.util.Objects;

/**
 * Opaque key/value capability descriptor. The value is carried verbatim; see
 * {@link AttributeValues} for the conventional value grammar.
 */
public record Attribute(String key, String value) {
    public Attribute {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Attribute of(String key, String value) {
        return new Attribute(key, value);
    }
}
