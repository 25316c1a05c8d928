package org.endlesssource.omxstore.spi;

import org.endlesssource.omxstore.ProviderSupport;
import org.endlesssource.omxstore.api.Omx;

/**
 * SPI implemented by node provider modules, discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface OmxProvider {

    /**
     * Stable provider name, referenced by the {@code owner} of configured nodes.
     */
    String providerName();

    /**
     * Probe runtime availability (native libraries, services, permissions).
     */
    ProviderSupport probeSupport();

    /**
     * Open the provider handle. Called once per factory call; the handle is shared by the deployments it builds.
     */
    Omx open();
}
