package org.endlesssource.omxstore.software;

import org.endlesssource.omxstore.api.Omx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Handle for the software codec nodes shipped with the platform.
 */
final class SoftwareOmx implements Omx {
    private static final Logger logger = LoggerFactory.getLogger(SoftwareOmx.class);

    static final List<String> DEFAULT_NODES = List.of(
            "OMX.google.aac.decoder",
            "OMX.google.aac.encoder",
            "OMX.google.amrnb.decoder",
            "OMX.google.amrnb.encoder",
            "OMX.google.amrwb.decoder",
            "OMX.google.amrwb.encoder",
            "OMX.google.flac.decoder",
            "OMX.google.flac.encoder",
            "OMX.google.g711.alaw.decoder",
            "OMX.google.g711.mlaw.decoder",
            "OMX.google.gsm.decoder",
            "OMX.google.mp3.decoder",
            "OMX.google.opus.decoder",
            "OMX.google.raw.decoder",
            "OMX.google.vorbis.decoder",
            "OMX.google.h263.decoder",
            "OMX.google.h263.encoder",
            "OMX.google.h264.decoder",
            "OMX.google.h264.encoder",
            "OMX.google.hevc.decoder",
            "OMX.google.mpeg2.decoder",
            "OMX.google.mpeg4.decoder",
            "OMX.google.mpeg4.encoder",
            "OMX.google.vp8.decoder",
            "OMX.google.vp8.encoder",
            "OMX.google.vp9.decoder",
            "OMX.google.vp9.encoder");

    private final String name;
    private final List<String> nodes;

    SoftwareOmx(String name, List<String> nodes) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.nodes = List.copyOf(nodes);
        logger.debug("Software provider {} serves {} nodes", name, this.nodes.size());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> listNodes() {
        return nodes;
    }
}
