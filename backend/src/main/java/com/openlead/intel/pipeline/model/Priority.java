package com.openlead.intel.pipeline.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    static final double HIGH_THRESHOLD = 70.0;
    static final double MEDIUM_THRESHOLD = 40.0;

    public static Priority fromTotal(double total) {
        if (total >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (total >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
