package org.endlesssource.omxstore.api;

/**
 * Status reported with the service attribute listing
 */
public enum Status {
    OK,
    /**
     * The attribute snapshot was never loaded. Stores built by the factory fail
     * at startup instead, so only other {@link OmxStore} implementations report it.
     */
    NO_INIT
}
