package com.packetsentinel.core.detection;

import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;

import java.util.List;

/**
 * Contract of the three detection layers.
 *
 * <p>
 * The coordinator holds a fixed list of detectors and calls
 * {@link #detect(AnalysisContext)} for every packet, possibly from several
 * worker threads at once. Implementations must therefore be thread-safe.
 * They report "nothing found" and "model not ready" alike as an empty list;
 * exceptions are reserved for real faults, which the coordinator isolates.
 * </p>
 *
 * @since 1.0.0
 */
public interface Detector {

    /**
     * @return the layer this detector implements
     */
    DetectorKind kind();

    /**
     * Analyze one packet.
     *
     * @param context packet, its features and the recent activity of its
     *                source
     * @return detections, possibly empty, never {@code null}
     */
    List<Detection> detect(AnalysisContext context);
}
