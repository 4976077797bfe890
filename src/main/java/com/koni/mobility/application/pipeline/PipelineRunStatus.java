package com.koni.mobility.application.pipeline;

public enum PipelineRunStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
