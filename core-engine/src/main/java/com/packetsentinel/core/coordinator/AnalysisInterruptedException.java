package com.packetsentinel.core.coordinator;

/**
 * The thread analyzing a packet was interrupted before every detector
 * reported. The packet's analysis is incomplete and its detections are
 * discarded. The interrupt flag of the analyzing thread is still set.
 *
 * @since 1.0.0
 */
public class AnalysisInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnalysisInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
