package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;

/**
 * Fires when a source sends more bytes than the threshold within the
 * window.
 *
 * @since 1.0.0
 */
public class ExfiltrationRule extends AggregateRule {

    public ExfiltrationRule(SignatureRuleDefinition definition) {
        super(definition);
    }

    @Override
    protected double observe(AnalysisContext context) {
        return context.getRecentActivity().totalBytes(getWindow());
    }

    @Override
    protected String evidence(double observed) {
        return String.format("%d bytes sent in %s (threshold %.0f)", (long) observed, windowText(), getThreshold());
    }
}
