package com.openlead.intel.pipeline.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between whoever started a run and the orchestrator
 * executing it. The first reason given wins.
 */
public final class RunCancellation {
    public static final String TIME_BUDGET_EXCEEDED = "time_budget_exceeded";
    public static final String INTERRUPTED = "interrupted";

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public boolean cancel(String reason) {
        return this.reason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
