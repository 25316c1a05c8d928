package org.endlesssource.omxstore.api;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Standard component role names for common media types, e.g.
 * {@code video/avc} decoding is {@code video_decoder.avc}.
 */
public final class ComponentRoles {
    private static final Map<String, String> SUFFIXES = Map.ofEntries(
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/mpeg-l1", "mp1"),
            Map.entry("audio/mpeg-l2", "mp2"),
            Map.entry("audio/3gpp", "amrnb"),
            Map.entry("audio/amr-wb", "amrwb"),
            Map.entry("audio/mp4a-latm", "aac"),
            Map.entry("audio/vorbis", "vorbis"),
            Map.entry("audio/opus", "opus"),
            Map.entry("audio/g711-alaw", "g711alaw"),
            Map.entry("audio/g711-mlaw", "g711mlaw"),
            Map.entry("audio/raw", "raw"),
            Map.entry("audio/flac", "flac"),
            Map.entry("audio/gsm", "gsm"),
            Map.entry("audio/ac3", "ac3"),
            Map.entry("audio/eac3", "eac3"),
            Map.entry("audio/eac3-joc", "eac3_joc"),
            Map.entry("audio/ac4", "ac4"),
            Map.entry("video/avc", "avc"),
            Map.entry("video/hevc", "hevc"),
            Map.entry("video/mp4v-es", "mpeg4"),
            Map.entry("video/3gpp", "h263"),
            Map.entry("video/mpeg2", "mpeg2"),
            Map.entry("video/x-vnd.on2.vp8", "vp8"),
            Map.entry("video/x-vnd.on2.vp9", "vp9"),
            Map.entry("video/av01", "av1"),
            Map.entry("video/dolby-vision", "dolby-vision"),
            Map.entry("image/vnd.android.heic", "heic"));

    private ComponentRoles() {
    }

    /**
     * Derive the standard role for a media type.
     *
     * @param mediaType MIME type, matched case-insensitively
     * @param isEncoder encoder or decoder role
     * @return the role name, or empty if the media type has no standard role
     */
    public static Optional<String> roleFor(String mediaType, boolean isEncoder) {
        if (mediaType == null) {
            return Optional.empty();
        }
        String normalized = mediaType.toLowerCase(Locale.ROOT);
        String suffix = SUFFIXES.get(normalized);
        if (suffix == null) {
            return Optional.empty();
        }
        String kind = normalized.substring(0, normalized.indexOf('/'));
        return Optional.of(kind + (isEncoder ? "_encoder." : "_decoder.") + suffix);
    }
}
