package com.packetsentinel.core.detection;

import com.packetsentinel.core.model.FeatureVector;
import com.packetsentinel.core.model.PacketRecord;

import java.util.Objects;

/**
 * Read-only inputs shared by all detectors for one packet.
 *
 * @since 1.0.0
 */
public final class AnalysisContext {

    private final PacketRecord packet;
    private final FeatureVector features;
    private final SourceActivity recentActivity;

    public AnalysisContext(PacketRecord packet, FeatureVector features, SourceActivity recentActivity) {
        this.packet = Objects.requireNonNull(packet, "packet must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.recentActivity = Objects.requireNonNull(recentActivity, "recentActivity must not be null");
    }

    public PacketRecord getPacket() {
        return packet;
    }

    public FeatureVector getFeatures() {
        return features;
    }

    /**
     * @return recent packets of the packet's source, including this one
     */
    public SourceActivity getRecentActivity() {
        return recentActivity;
    }
}
