package com.openlead.intel.pipeline.service;

public class ActivePipelineRunException extends RuntimeException {
    private final String activeRunId;

    public ActivePipelineRunException(String activeRunId) {
        super("Pipeline run already active: " + activeRunId);
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
