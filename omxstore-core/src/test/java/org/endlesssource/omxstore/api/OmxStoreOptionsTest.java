package org.endlesssource.omxstore.api;

import org.endlesssource.omxstore.test.DummyOmx;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OmxStoreOptionsTest {

    @Test
    void defaults_areExpected() {
        OmxStoreOptions defaults = OmxStoreOptions.defaults();
        assertTrue(defaults.isProviderDiscoveryEnabled());
        assertEquals(OmxStoreOptions.DEFAULT_CONFIG_RESOURCE, defaults.getConfigResource());
        assertTrue(defaults.getConfigFile().isEmpty());
        assertTrue(defaults.getProviders().isEmpty());
    }

    @Test
    void withMethods_returnCopies() {
        OmxStoreOptions defaults = OmxStoreOptions.defaults();
        DummyOmx omx = new DummyOmx("test-omx", List.of());
        OmxStoreOptions changed = defaults
                .withConfigFile(Path.of("custom.conf"))
                .withConfigResource("other.conf")
                .withProviderDiscovery(false)
                .withProvider(omx);

        assertEquals(Path.of("custom.conf"), changed.getConfigFile().orElseThrow());
        assertEquals("other.conf", changed.getConfigResource());
        assertFalse(changed.isProviderDiscoveryEnabled());
        assertEquals(List.of(omx), changed.getProviders());
        assertTrue(defaults.getProviders().isEmpty());
    }

    @Test
    void invalidValues_areRejected() {
        OmxStoreOptions defaults = OmxStoreOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withConfigResource(" "));
        assertThrows(NullPointerException.class, () -> defaults.withConfigResource(null));
        assertThrows(NullPointerException.class, () -> defaults.withConfigFile(null));
        assertThrows(NullPointerException.class, () -> defaults.withProvider(null));
    }
}
