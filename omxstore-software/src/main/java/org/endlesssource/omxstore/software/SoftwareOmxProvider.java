package org.endlesssource.omxstore.software;

import org.endlesssource.omxstore.ProviderSupport;
import org.endlesssource.omxstore.api.Omx;
import org.endlesssource.omxstore.spi.OmxProvider;

public final class SoftwareOmxProvider implements OmxProvider {
    public static final String NAME = "software-omx";
    public static final String ENABLED_PROPERTY = "omxstore.software.enabled";

    @Override
    public String providerName() {
        return NAME;
    }

    @Override
    public ProviderSupport probeSupport() {
        if (!Boolean.parseBoolean(System.getProperty(ENABLED_PROPERTY, "true"))) {
            return ProviderSupport.unavailable(NAME, "Disabled by " + ENABLED_PROPERTY);
        }
        return ProviderSupport.available(NAME);
    }

    @Override
    public Omx open() {
        return new SoftwareOmx(NAME, SoftwareOmx.DEFAULT_NODES);
    }
}
