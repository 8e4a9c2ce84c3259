package com.openlead.intel.pipeline.score;

import com.openlead.intel.pipeline.service.PipelineConfigurationException;

public record ScoringWeights(double intent, double fit, double tech, double engagement) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(0.35, 0.30, 0.20, 0.15);

    private static final double SUM_TOLERANCE = 0.01;

    public ScoringWeights {
        requireWeight("intent", intent);
        requireWeight("fit", fit);
        requireWeight("tech", tech);
        requireWeight("engagement", engagement);
        if (intent + fit + tech + engagement <= 0.0) {
            throw new PipelineConfigurationException("scoring weights must sum to a positive value");
        }
    }

    public double sum() {
        return intent + fit + tech + engagement;
    }

    public boolean isNormalized() {
        return Math.abs(sum() - 1.0) <= SUM_TOLERANCE;
    }

    /**
     * Returns these weights scaled to sum to 1.0, or {@code this} when already within tolerance.
     */
    public ScoringWeights normalized() {
        if (isNormalized()) {
            return this;
        }
        double total = sum();
        return new ScoringWeights(intent / total, fit / total, tech / total, engagement / total);
    }

    private static void requireWeight(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
            throw new PipelineConfigurationException("scoring weight '" + name + "' must be a finite value >= 0");
        }
    }
}
