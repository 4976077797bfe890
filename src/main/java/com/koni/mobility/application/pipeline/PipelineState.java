package com.koni.mobility.application.pipeline;

/**
 * Stages of a pipeline run. A pipeline is {@code IDLE} between runs.
 */
public enum PipelineState {
    IDLE,
    FETCHING,
    RECONCILING,
    INGESTING
}
