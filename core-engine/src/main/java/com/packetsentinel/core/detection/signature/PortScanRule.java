package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;

/**
 * Fires when a source touches more distinct destination ports than the
 * threshold within the window.
 *
 * @since 1.0.0
 */
public class PortScanRule extends AggregateRule {

    public PortScanRule(SignatureRuleDefinition definition) {
        super(definition);
    }

    @Override
    protected double observe(AnalysisContext context) {
        return context.getRecentActivity().distinctDestinationPorts(getWindow());
    }

    @Override
    protected String evidence(double observed) {
        return String.format("%d distinct destination ports in %s (threshold %.0f)",
                (long) observed, windowText(), getThreshold());
    }
}
