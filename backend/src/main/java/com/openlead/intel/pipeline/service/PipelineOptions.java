package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;

public record PipelineOptions(boolean deduplicate, boolean enrich, boolean score, double minScoreThreshold) {
    public PipelineOptions {
        if (Double.isNaN(minScoreThreshold) || minScoreThreshold < 0.0 || minScoreThreshold > 100.0) {
            throw new PipelineConfigurationException("minScoreThreshold must be in [0, 100], got " + minScoreThreshold);
        }
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(true, true, true, 0.0);
    }

    public static PipelineOptions from(PipelineProperties properties) {
        return new PipelineOptions(
            properties.getDeduplication().isEnabled(),
            properties.getEnrichment().isEnabled(),
            properties.getScoring().isEnabled(),
            properties.getMinScoreThreshold()
        );
    }

    public boolean filters() {
        return score && minScoreThreshold > 0.0;
    }
}
