package com.openlead.intel.pipeline.model;

public enum PipelineStage {
    IDLE,
    COLLECTING,
    DEDUPLICATING,
    ENRICHING,
    SCORING,
    FILTERING,
    DONE
}
