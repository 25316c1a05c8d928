package org.endlesssource.omxstore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.endlesssource.omxstore.OmxStoreConfigException;
import org.endlesssource.omxstore.api.OmxStoreOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {
    private static final String VENDOR_PREFIX = "omxstore.instances.vendor.prefix";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(VENDOR_PREFIX);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void load_mergesResourceOverReference() {
        Config config = ConfigLoader.load(OmxStoreOptions.defaults());
        assertEquals("OMX.vendor.", config.getString(VENDOR_PREFIX));
        assertEquals(2, config.getConfigList("omxstore.instances.platform.roles").size());
    }

    @Test
    void load_missingResource_fallsBackToReference() {
        Config config = ConfigLoader.load(OmxStoreOptions.defaults().withConfigResource("absent.conf"));
        assertEquals("OMX.", config.getString(VENDOR_PREFIX));
        assertTrue(config.getConfigList("omxstore.instances.platform.roles").isEmpty());
    }

    @Test
    void load_fileOverridesResource(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "omxstore.instances.vendor.prefix = \"OMX.file.\"", StandardCharsets.UTF_8);

        Config config = ConfigLoader.load(OmxStoreOptions.defaults().withConfigFile(file));
        assertEquals("OMX.file.", config.getString(VENDOR_PREFIX));
        assertEquals(2, config.getConfigList("omxstore.instances.platform.roles").size());
    }

    @Test
    void load_missingExplicitFile_fails(@TempDir Path dir) {
        OmxStoreOptions options = OmxStoreOptions.defaults().withConfigFile(dir.resolve("missing.conf"));
        assertThrows(OmxStoreConfigException.class, () -> ConfigLoader.load(options));
    }

    @Test
    void load_malformedFile_fails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.conf");
        Files.writeString(file, "omxstore.instances { vendor = [", StandardCharsets.UTF_8);

        OmxStoreConfigException error = assertThrows(OmxStoreConfigException.class,
                () -> ConfigLoader.load(OmxStoreOptions.defaults().withConfigFile(file)));
        assertInstanceOf(ConfigException.class, error.getCause());
    }

    @Test
    void load_systemPropertyOverridesEverything() {
        System.setProperty(VENDOR_PREFIX, "OMX.sysprop.");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(OmxStoreOptions.defaults());
        assertEquals("OMX.sysprop.", config.getString(VENDOR_PREFIX));
    }
}
