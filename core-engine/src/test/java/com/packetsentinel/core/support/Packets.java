package com.packetsentinel.core.support;

import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Protocol;

import java.time.Instant;

/**
 * Packet fixtures shared by the tests.
 */
public final class Packets {

    public static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private Packets() {
    }

    public static PacketRecord.Builder tcp(String sourceIp, String destinationIp, int destinationPort) {
        return PacketRecord.builder()
                .timestamp(T0)
                .sourceIp(sourceIp)
                .sourcePort(40000)
                .destinationIp(destinationIp)
                .destinationPort(destinationPort)
                .protocol(Protocol.TCP)
                .size(120);
    }

    public static PacketRecord withPayload(String payload) {
        return tcp("10.0.0.5", "10.0.0.1", 80).payload(payload).size(payload.length() + 40).build();
    }
}
