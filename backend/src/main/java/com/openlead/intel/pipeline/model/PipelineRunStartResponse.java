package com.openlead.intel.pipeline.model;

public record PipelineRunStartResponse(String runId, PipelineRunStatus status, String statusUrl) {
}
