package org.endlesssource.omxstore.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentRolesTest {

    @Test
    void roleFor_knownTypes() {
        assertEquals(Optional.of("video_decoder.avc"), ComponentRoles.roleFor("video/avc", false));
        assertEquals(Optional.of("video_encoder.vp9"), ComponentRoles.roleFor("video/x-vnd.on2.vp9", true));
        assertEquals(Optional.of("audio_decoder.aac"), ComponentRoles.roleFor("audio/mp4a-latm", false));
        assertEquals(Optional.of("audio_decoder.mp1"), ComponentRoles.roleFor("audio/mpeg-L1", false));
        assertEquals(Optional.of("image_encoder.heic"), ComponentRoles.roleFor("image/vnd.android.heic", true));
    }

    @Test
    void roleFor_unknownType_isEmpty() {
        assertTrue(ComponentRoles.roleFor("video/unknown", false).isEmpty());
        assertTrue(ComponentRoles.roleFor(null, false).isEmpty());
    }
}
