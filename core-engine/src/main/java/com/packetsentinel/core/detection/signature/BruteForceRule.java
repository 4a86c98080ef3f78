package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.model.FeatureLayout.FeatureNames;

/**
 * Fires when the {@code failed_login_attempts} feature of the packet
 * reaches the threshold. The login window is owned by the login attempt
 * tracker, so {@code windowSeconds} is ignored here.
 *
 * @since 1.0.0
 */
public class BruteForceRule extends AggregateRule {

    public BruteForceRule(SignatureRuleDefinition definition) {
        super(definition);
    }

    @Override
    protected double observe(AnalysisContext context) {
        return context.getFeatures().getOrDefault(FeatureNames.FAILED_LOGIN_ATTEMPTS, 0.0);
    }

    @Override
    protected boolean exceeds(double observed) {
        return observed >= getThreshold();
    }

    @Override
    protected String evidence(double observed) {
        return String.format("%d failed logins in the login window (threshold %.0f)",
                (long) observed, getThreshold());
    }
}
