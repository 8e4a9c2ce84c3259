package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.adapter.AdapterInvocation;
import com.openlead.intel.pipeline.adapter.SourceAdapterFactory;
import com.openlead.intel.pipeline.enrich.Enricher;
import com.openlead.intel.pipeline.enrich.EnricherRegistry;
import com.openlead.intel.pipeline.model.PipelineRunRequest;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.PipelineRunStartResponse;
import com.openlead.intel.pipeline.model.PipelineRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps run requests onto adapter invocations and enrichers, and keeps track of recent runs so
 * they can be polled and cancelled.
 */
@Service
public class PipelineRunService {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunService.class);
    private static final int MAX_TRACKED_RUNS = 100;

    private final PipelineOrchestrator orchestrator;
    private final SourceAdapterFactory adapterFactory;
    private final EnricherRegistry enricherRegistry;
    private final PipelineProperties properties;
    private final ExecutorService pipelineRunExecutor;
    private final AtomicReference<String> activeAsyncRun = new AtomicReference<>();
    private final Map<String, TrackedRun> runs = Collections.synchronizedMap(new LinkedHashMap<>());

    public PipelineRunService(
        PipelineOrchestrator orchestrator,
        SourceAdapterFactory adapterFactory,
        EnricherRegistry enricherRegistry,
        PipelineProperties properties,
        @Qualifier("pipelineRunExecutor") ExecutorService pipelineRunExecutor
    ) {
        this.orchestrator = orchestrator;
        this.adapterFactory = adapterFactory;
        this.enricherRegistry = enricherRegistry;
        this.properties = properties;
        this.pipelineRunExecutor = pipelineRunExecutor;
    }

    public PipelineRunResult run(PipelineRunRequest request) {
        ResolvedRun resolved = resolve(request);
        TrackedRun tracked = track(UUID.randomUUID().toString());
        return execute(tracked, resolved);
    }

    public PipelineRunStartResponse startAsync(PipelineRunRequest request) {
        ResolvedRun resolved = resolve(request);
        String runId = UUID.randomUUID().toString();
        if (!activeAsyncRun.compareAndSet(null, runId)) {
            throw new ActivePipelineRunException(activeAsyncRun.get());
        }
        TrackedRun tracked = track(runId);
        try {
            pipelineRunExecutor.submit(() -> {
                try {
                    execute(tracked, resolved);
                } finally {
                    activeAsyncRun.compareAndSet(runId, null);
                }
            });
        } catch (RejectedExecutionException e) {
            activeAsyncRun.compareAndSet(runId, null);
            runs.remove(runId);
            throw e;
        }
        return new PipelineRunStartResponse(runId, PipelineRunStatus.RUNNING, "/api/pipeline/runs/" + runId);
    }

    public Optional<PipelineRunResult> find(String runId) {
        TrackedRun tracked = runs.get(runId);
        return tracked == null ? Optional.empty() : Optional.of(tracked.result);
    }

    /**
     * Requests cancellation of a running pipeline. Returns the run's current state, or empty
     * when the run is unknown.
     */
    public Optional<PipelineRunResult> cancel(String runId) {
        TrackedRun tracked = runs.get(runId);
        if (tracked == null) {
            return Optional.empty();
        }
        if (!tracked.result.status().isTerminal() && tracked.cancellation.cancel("cancelled_by_request")) {
            log.info("Cancellation requested for pipeline run {}", runId);
        }
        return Optional.of(tracked.result);
    }

    ResolvedRun resolve(PipelineRunRequest request) {
        if (request == null) {
            throw new PipelineConfigurationException("request body is required");
        }
        int maxRecords = request.maxRecordsPerSource() == null
            ? properties.getCli().getMaxRecordsPerSource()
            : request.maxRecordsPerSource();
        List<AdapterInvocation<?>> invocations = adapterFactory.invocations(
            request.normalizedListingUrls(),
            request.normalizedCsvFiles(),
            maxRecords
        );
        if (invocations.isEmpty()) {
            throw new PipelineConfigurationException("at least one listing url or csv file is required");
        }

        PipelineOptions defaults = PipelineOptions.from(properties);
        PipelineOptions options = new PipelineOptions(
            request.deduplicate() == null ? defaults.deduplicate() : request.deduplicate(),
            request.enrich() == null ? defaults.enrich() : request.enrich(),
            request.score() == null ? defaults.score() : request.score(),
            request.minScore() == null ? defaults.minScoreThreshold() : request.minScore()
        );
        List<String> enricherNames = request.enrichers() == null
            ? properties.getEnrichment().getEnrichers()
            : request.enrichers();
        List<Enricher> enrichers = options.enrich() ? enricherRegistry.resolve(enricherNames) : List.of();
        return new ResolvedRun(invocations, enrichers, options);
    }

    private TrackedRun track(String runId) {
        TrackedRun tracked = new TrackedRun(new RunCancellation(), PipelineRunResult.running(runId, Instant.now()));
        synchronized (runs) {
            runs.put(runId, tracked);
            evictFinishedRuns();
        }
        return tracked;
    }

    // Drops the oldest finished runs first; runs still in progress are never evicted.
    private void evictFinishedRuns() {
        Iterator<TrackedRun> oldestFirst = runs.values().iterator();
        while (runs.size() > MAX_TRACKED_RUNS && oldestFirst.hasNext()) {
            if (oldestFirst.next().result.status().isTerminal()) {
                oldestFirst.remove();
            }
        }
    }

    int trackedRunCount() {
        return runs.size();
    }

    private PipelineRunResult execute(TrackedRun tracked, ResolvedRun resolved) {
        PipelineRunResult result = orchestrator.run(
            tracked.result.runId(),
            resolved.invocations(),
            resolved.enrichers(),
            resolved.options(),
            tracked.cancellation
        );
        tracked.result = result;
        return result;
    }

    record ResolvedRun(List<AdapterInvocation<?>> invocations, List<Enricher> enrichers, PipelineOptions options) {
    }

    private static final class TrackedRun {
        private final RunCancellation cancellation;
        private volatile PipelineRunResult result;

        private TrackedRun(RunCancellation cancellation, PipelineRunResult result) {
            this.cancellation = cancellation;
            this.result = result;
        }
    }
}
