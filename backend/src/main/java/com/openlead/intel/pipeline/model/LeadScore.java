package com.openlead.intel.pipeline.model;

import com.openlead.intel.pipeline.score.ScoringWeights;

/**
 * Composite lead score. The total is always derived from the components and the weights
 * they were combined with; it cannot be set independently.
 */
public final class LeadScore {
    private final double intent;
    private final double fit;
    private final double tech;
    private final double engagement;
    private final double total;
    private final Priority priority;

    private LeadScore(double intent, double fit, double tech, double engagement, double total, Priority priority) {
        this.intent = intent;
        this.fit = fit;
        this.tech = tech;
        this.engagement = engagement;
        this.total = total;
        this.priority = priority;
    }

    public static LeadScore compute(
        double intent,
        double fit,
        double tech,
        double engagement,
        ScoringWeights weights
    ) {
        double cappedIntent = cap(intent);
        double cappedFit = cap(fit);
        double cappedTech = cap(tech);
        double cappedEngagement = cap(engagement);
        double total = cap(
            cappedIntent * weights.intent()
                + cappedFit * weights.fit()
                + cappedTech * weights.tech()
                + cappedEngagement * weights.engagement()
        );
        return new LeadScore(
            round(cappedIntent),
            round(cappedFit),
            round(cappedTech),
            round(cappedEngagement),
            round(total),
            Priority.fromTotal(total)
        );
    }

    public double getIntent() {
        return intent;
    }

    public double getFit() {
        return fit;
    }

    public double getTech() {
        return tech;
    }

    public double getEngagement() {
        return engagement;
    }

    /**
     * Weighted total rounded to two decimals. {@link #getPriority()} is bucketed from the
     * unrounded value, so a total reported as 70.0 can still be {@link Priority#MEDIUM}.
     */
    public double getTotal() {
        return total;
    }

    public Priority getPriority() {
        return priority;
    }

    private static double cap(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    @Override
    public String toString() {
        return String.format("%.2f (%s)", total, priority);
    }
}
