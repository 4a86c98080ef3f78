/**
 * Bounded queue, worker pool and timers that drive packets through the
 * detection engine.
 *
 * <p>
 * Start with {@link com.packetsentinel.core.pipeline.PipelineAssembler}.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.pipeline;
