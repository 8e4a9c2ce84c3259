package com.openlead.intel.pipeline.service;

public class PipelineConfigurationException extends RuntimeException {
    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
