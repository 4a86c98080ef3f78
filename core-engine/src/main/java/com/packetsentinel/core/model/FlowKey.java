package com.packetsentinel.core.model;

import java.util.Objects;

/**
 * Identity of a flow as tracked by the feature trackers: source IP,
 * destination IP and destination port.
 *
 * @since 1.0.0
 */
public final class FlowKey {

    private final String sourceIp;
    private final String destinationIp;
    private final int destinationPort;

    public FlowKey(String sourceIp, String destinationIp, int destinationPort) {
        this.sourceIp = Objects.requireNonNull(sourceIp, "sourceIp must not be null");
        this.destinationIp = Objects.requireNonNull(destinationIp, "destinationIp must not be null");
        this.destinationPort = destinationPort;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public String getDestinationIp() {
        return destinationIp;
    }

    public int getDestinationPort() {
        return destinationPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlowKey that))
            return false;
        return destinationPort == that.destinationPort
                && sourceIp.equals(that.sourceIp)
                && destinationIp.equals(that.destinationIp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceIp, destinationIp, destinationPort);
    }

    @Override
    public String toString() {
        return sourceIp + "->" + destinationIp + ":" + destinationPort;
    }
}
