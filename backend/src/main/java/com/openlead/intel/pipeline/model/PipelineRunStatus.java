package com.openlead.intel.pipeline.model;

public enum PipelineRunStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    NO_RECORDS,
    ALL_SOURCES_FAILED,
    CANCELLED,
    FAILED;

    public boolean isFailed() {
        return this == ALL_SOURCES_FAILED || this == FAILED;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
