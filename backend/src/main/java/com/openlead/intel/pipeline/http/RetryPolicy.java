package com.openlead.intel.pipeline.http;

import com.openlead.intel.pipeline.service.PipelineConfigurationException;

import java.time.Duration;

/**
 * Exponential backoff settings for {@link PoliteHttpClient}. Attempt numbers are 1-based;
 * {@code maxAttempts} counts the first try.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new PipelineConfigurationException("maxAttempts must be >= 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new PipelineConfigurationException("baseDelay must be >= 0");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new PipelineConfigurationException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new PipelineConfigurationException("maxDelay must be >= 0");
        }
    }

    public boolean hasAttemptsAfter(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the retry that follows {@code attempt}, without jitter.
     */
    public Duration delayAfter(int attempt) {
        long baseMs = baseDelay.toMillis();
        if (baseMs <= 0) {
            return Duration.ZERO;
        }
        double delay = baseMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        long maxMs = maxDelay.toMillis();
        if (maxMs > 0) {
            delay = Math.min(delay, maxMs);
        }
        return Duration.ofMillis((long) delay);
    }
}
