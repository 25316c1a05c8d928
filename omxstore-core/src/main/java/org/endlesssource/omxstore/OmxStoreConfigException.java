package org.endlesssource.omxstore;

/**
 * Thrown when a store deployment cannot be assembled from its configuration.
 * A store that failed this way is never handed out.
 */
public class OmxStoreConfigException extends RuntimeException {

    public OmxStoreConfigException(String message) {
        super(message);
    }

    public OmxStoreConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
