package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.model.Detection;

import java.util.Optional;

/**
 * A single compiled signature rule.
 *
 * <p>
 * Rules are immutable after construction and evaluated concurrently by
 * several workers.
 * </p>
 *
 * @since 1.0.0
 */
public interface SignatureRule {

    /**
     * Evaluate the rule against one packet.
     *
     * @param context the packet under analysis
     * @return a detection if the rule fires, empty otherwise
     */
    Optional<Detection> evaluate(AnalysisContext context);

    /**
     * @return unique rule name, used as the detection rule id
     */
    String getName();
}
