package com.packetsentinel.core.feature;

import com.packetsentinel.core.model.FeatureLayout;
import com.packetsentinel.core.model.FeatureLayout.FeatureNames;
import com.packetsentinel.core.model.FeatureVector;
import com.packetsentinel.core.model.FlowKey;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.tracking.FeatureTrackers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Turns a {@link PacketRecord} into a {@link FeatureVector}.
 *
 * <h3>Side Effects</h3>
 * <p>
 * Every call updates the trackers it was built with: the flow is upserted in
 * the connection tracker, its bytes are added to the flow rate, the source is
 * counted for access frequency and, when the payload carries a failed-login
 * response, the client (the packet's destination) gets a login failure.
 * Tracker time is the packet's capture timestamp.
 * </p>
 *
 * <h3>Features</h3>
 * <table>
 * <caption>Feature definitions</caption>
 * <tr><td>{@code packet_size}</td><td>wire size in bytes</td></tr>
 * <tr><td>{@code protocol_type}</td><td>{@link com.packetsentinel.core.model.Protocol#code()}</td></tr>
 * <tr><td>{@code connection_duration}</td><td>seconds since the flow was first seen</td></tr>
 * <tr><td>{@code failed_login_attempts}</td><td>failures of the source in the login window</td></tr>
 * <tr><td>{@code data_transfer_rate}</td><td>flow bytes per second</td></tr>
 * <tr><td>{@code access_frequency}</td><td>packets of the source in the access window</td></tr>
 * <tr><td>{@code src_port}, {@code dst_port}, {@code tcp_flags}</td><td>extended layout only</td></tr>
 * <tr><td>{@code payload_entropy}</td><td>Shannon entropy in bits per byte, extended only</td></tr>
 * <tr><td>{@code hour_of_day}</td><td>UTC hour of the capture timestamp, extended only</td></tr>
 * </table>
 *
 * <p>
 * {@link #extract(PacketRecord)} never throws. If anything goes wrong the
 * all-zero vector of the layout is returned.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureExtractor.class);

    private final FeatureTrackers trackers;
    private final FeatureLayout layout;

    public FeatureExtractor(FeatureTrackers trackers, FeatureLayout layout) {
        this.trackers = Objects.requireNonNull(trackers, "trackers must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
    }

    /**
     * Update the trackers with {@code packet} and compute its features.
     *
     * @param packet packet to analyze
     * @return vector in {@link #layout()} order
     */
    public FeatureVector extract(PacketRecord packet) {
        try {
            return doExtract(packet);
        } catch (RuntimeException e) {
            LOG.debug("Feature extraction failed for {}, using zero vector", packet, e);
            return FeatureVector.zeros(layout);
        }
    }

    public FeatureLayout layout() {
        return layout;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private FeatureVector doExtract(PacketRecord packet) {
        Instant at = packet.getTimestamp();
        FlowKey flow = packet.flowKey();
        String source = packet.getSourceIp();
        int size = packet.getSize();

        trackers.connections().record(flow, at, size);
        trackers.flowRates().record(flow, at, size);
        trackers.accessFrequency().record(source, at);
        if (AuthFailureMatcher.isAuthFailure(packet)) {
            LOG.trace("Failed login response to {}", packet.getDestinationIp());
            trackers.loginAttempts().record(packet.getDestinationIp(), at);
        }

        FeatureVector.Builder builder = FeatureVector.builder()
                .add(FeatureNames.PACKET_SIZE, size)
                .add(FeatureNames.PROTOCOL_TYPE, packet.getProtocol().code())
                .add(FeatureNames.CONNECTION_DURATION, trackers.connections().query(flow, at).orElse(0.0))
                .add(FeatureNames.FAILED_LOGIN_ATTEMPTS, trackers.loginAttempts().query(source, at))
                .add(FeatureNames.DATA_TRANSFER_RATE, trackers.flowRates().query(flow, at))
                .add(FeatureNames.ACCESS_FREQUENCY, trackers.accessFrequency().query(source, at));

        if (layout == FeatureLayout.EXTENDED) {
            builder.add(FeatureNames.SOURCE_PORT, packet.getSourcePort())
                    .add(FeatureNames.DESTINATION_PORT, packet.getDestinationPort())
                    .add(FeatureNames.TCP_FLAGS, packet.getTcpFlags())
                    .add(FeatureNames.PAYLOAD_ENTROPY, entropy(packet.getPayload()))
                    .add(FeatureNames.HOUR_OF_DAY, at.atZone(ZoneOffset.UTC).getHour());
        }
        return builder.build();
    }

    /**
     * Shannon entropy of {@code data} in bits per byte, {@code 0} for empty
     * input.
     */
    static double entropy(byte[] data) {
        if (data.length == 0) {
            return 0.0;
        }
        int[] counts = new int[256];
        for (byte b : data) {
            counts[b & 0xFF]++;
        }
        double entropy = 0.0;
        for (int count : counts) {
            if (count > 0) {
                double p = (double) count / data.length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }
}
