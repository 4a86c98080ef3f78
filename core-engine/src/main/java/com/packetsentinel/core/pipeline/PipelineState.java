package com.packetsentinel.core.pipeline;

/**
 * Lifecycle of a {@link PacketPipeline}.
 *
 * @since 1.0.0
 */
public enum PipelineState {
    NEW,
    RUNNING,
    STOPPING,
    STOPPED
}
