package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;

/**
 * DoS burst: more packets from one source than the threshold within the
 * window.
 *
 * @since 1.0.0
 */
public class PacketBurstRule extends AggregateRule {

    public PacketBurstRule(SignatureRuleDefinition definition) {
        super(definition);
    }

    @Override
    protected double observe(AnalysisContext context) {
        return context.getRecentActivity().packetCount(getWindow());
    }

    @Override
    protected String evidence(double observed) {
        return String.format("%d packets in %s (threshold %.0f)", (long) observed, windowText(), getThreshold());
    }
}
