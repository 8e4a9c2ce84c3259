package com.openlead.intel.pipeline.service;

public class PipelineCancelledException extends RuntimeException {
    private final String reason;

    public PipelineCancelledException(String reason) {
        super("Pipeline run cancelled: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
