package com.openlead.intel.pipeline.model;

import java.time.Instant;
import java.util.List;

public record PipelineRunResult(
    String runId,
    PipelineRunStatus status,
    Instant startedAt,
    Instant finishedAt,
    int collectedCount,
    int dedupedCount,
    List<Company> companies,
    List<AdapterRunSummary> adapters,
    List<PipelineStage> stagesExecuted,
    List<PipelineStage> stagesSkipped,
    List<String> warnings,
    String notes
) {
    public boolean failed() {
        return status.isFailed();
    }

    public static PipelineRunResult running(String runId, Instant startedAt) {
        return new PipelineRunResult(
            runId,
            PipelineRunStatus.RUNNING,
            startedAt,
            null,
            0,
            0,
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            "run started"
        );
    }
}
