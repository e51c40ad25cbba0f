package com.phillippitts.liverelay.service.pipeline;

/**
 * Lifecycle states of a {@link StreamPipeline}.
 */
public enum PipelineState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING
}
