package org.endlesssource.omxstore;

import org.endlesssource.omxstore.api.Attribute;
import org.endlesssource.omxstore.api.NodeInfo;
import org.endlesssource.omxstore.api.Omx;
import org.endlesssource.omxstore.api.OmxStore;
import org.endlesssource.omxstore.api.OmxStoreOptions;
import org.endlesssource.omxstore.api.RoleInfo;
import org.endlesssource.omxstore.api.ServiceAttributes;
import org.endlesssource.omxstore.test.DummyOmx;
import org.endlesssource.omxstore.test.DummyOmxProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OmxStoreFactoryDummyProviderTest {

    @Test
    void create_nullArguments_throw() {
        assertThrows(NullPointerException.class, () -> OmxStoreFactory.create(null));
        assertThrows(NullPointerException.class, () -> OmxStoreFactory.create("platform", (OmxStoreOptions) null));
        assertThrows(NullPointerException.class, () -> OmxStoreFactory.createDeployments(null));
    }

    @Test
    void createDeployments_loadsPlatformAndVendorSideBySide() {
        OmxStoreDeployments deployments = OmxStoreFactory.createDeployments();

        assertEquals(List.of("platform", "vendor"), List.copyOf(deployments.instanceNames()));
        assertEquals("platform", deployments.platform().getInstanceName());
        assertEquals("vendor", deployments.vendor().getInstanceName());
        assertEquals("OMX.", deployments.platform().getNodePrefix());
        assertEquals("OMX.vendor.", deployments.vendor().getNodePrefix());
        assertTrue(deployments.get("unknown").isEmpty());
    }

    @Test
    void avcScenario_keepsNodeOrderAndResolvesOwners() {
        OmxStore store = OmxStoreFactory.create("platform");

        RoleInfo avc = store.listRoles().get(0);
        assertEquals("video_decoder.avc", avc.role());
        assertEquals("video/avc", avc.type());
        assertFalse(avc.isEncoder());
        assertTrue(avc.preferPlatformNodes());
        assertEquals(List.of("OMX.plat.avc.decoder", "OMX.vendor.avc.decoder"),
                avc.nodes().stream().map(NodeInfo::name).toList());
        assertEquals(List.of("platform-omx", "vendor-omx"),
                avc.nodes().stream().map(NodeInfo::owner).toList());

        Omx platformOmx = store.getOmx("platform-omx");
        assertNotNull(platformOmx);
        assertEquals("platform-omx", platformOmx.getName());
        assertNull(store.getOmx("unknown-omx"));
    }

    @Test
    void roleWithoutName_isDerivedFromTypeAndDirection() {
        OmxStore store = OmxStoreFactory.create("platform");

        RoleInfo aac = store.listRoles().get(1);
        assertEquals("audio_encoder.aac", aac.role());
        assertTrue(aac.isEncoder());
        assertTrue(aac.preferPlatformNodes());
    }

    @Test
    void everyNode_matchesPrefixAndResolvesOwner() {
        for (OmxStore store : OmxStoreFactory.createDeployments().all()) {
            for (RoleInfo role : store.listRoles()) {
                for (NodeInfo node : role.nodes()) {
                    assertTrue(node.name().startsWith(store.getNodePrefix()), node.name());
                    assertNotNull(store.getOmx(node.owner()), node.owner());
                }
            }
        }
    }

    @Test
    void listRoles_isDeterministic() {
        OmxStore store = OmxStoreFactory.create("platform");
        assertEquals(store.listRoles(), store.listRoles());
    }

    @Test
    void listServiceAttributes_keepsConfiguredOrder() {
        ServiceAttributes attributes = OmxStoreFactory.create("platform").listServiceAttributes();

        assertTrue(attributes.isOk());
        assertEquals(List.of(
                Attribute.of("max-video-encoder-input-buffers", "12"),
                Attribute.of("supports-multiple-secure-codecs", "0"),
                Attribute.of("supports-secure-with-non-secure-codec", "1")), attributes.attributes());
    }

    @Test
    void getOmx_neverOpensProvidersOnDemand() {
        OmxStore store = OmxStoreFactory.create("vendor");
        int opened = DummyOmxProvider.openCount("vendor-omx");

        for (int i = 0; i < 10; i++) {
            assertNotNull(store.getOmx("vendor-omx"));
            assertNull(store.getOmx("nonexistent-provider"));
        }
        assertEquals(opened, DummyOmxProvider.openCount("vendor-omx"));
    }

    @Test
    void unavailableProvider_isSkipped() {
        assertTrue(OmxStoreFactory.getDiscoveredProviders().contains("offline-omx"));
        assertFalse(OmxStoreFactory.getAvailableProviders().contains("offline-omx"));
        assertEquals(List.of("platform-omx", "vendor-omx"), OmxStoreFactory.getAvailableProviders());

        OmxStore store = OmxStoreFactory.create("platform");
        assertNull(store.getOmx("offline-omx"));
    }

    @Test
    void explicitProviders_replaceDiscovery() {
        OmxStoreOptions options = OmxStoreOptions.defaults()
                .withProviderDiscovery(false)
                .withProvider(new DummyOmx("platform-omx", List.of()))
                .withProvider(new DummyOmx("vendor-omx", List.of()));

        OmxStore store = OmxStoreFactory.create("platform", options);
        assertTrue(store.getOmx("platform-omx") instanceof DummyOmx);
        assertTrue(store.getOmx("platform-omx").listNodes().isEmpty());
    }

    @Test
    void missingOwnerProvider_abortsStartup() {
        OmxStoreOptions options = OmxStoreOptions.defaults()
                .withProviderDiscovery(false)
                .withProvider(new DummyOmx("platform-omx", List.of()));

        OmxStoreConfigException error = assertThrows(OmxStoreConfigException.class,
                () -> OmxStoreFactory.create("platform", options));
        assertTrue(error.getMessage().contains("vendor-omx"), error.getMessage());
    }

    @Test
    void createDeployments_failsWhenOneDeploymentFails() {
        OmxStoreOptions options = OmxStoreOptions.defaults()
                .withProviderDiscovery(false)
                .withProvider(new DummyOmx("vendor-omx", List.of()));

        OmxStoreConfigException error = assertThrows(OmxStoreConfigException.class,
                () -> OmxStoreFactory.createDeployments(options));
        assertTrue(error.getMessage().contains("platform-omx"), error.getMessage());
    }

    @Test
    void providerSupport_defaultsMissingReason() {
        assertEquals("", new ProviderSupport("test-omx", false, null).reason());
        assertThrows(NullPointerException.class, () -> new ProviderSupport(null, true, ""));
    }

    @Test
    void explicitProviderClashingWithDiscovered_isRejected() {
        OmxStoreOptions options = OmxStoreOptions.defaults()
                .withProvider(new DummyOmx("platform-omx", List.of()));

        assertThrows(OmxStoreConfigException.class, () -> OmxStoreFactory.create("platform", options));
    }
}
