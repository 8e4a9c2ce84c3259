package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.adapter.AdapterInvocation;
import com.openlead.intel.pipeline.dedup.CompanyDeduplicator;
import com.openlead.intel.pipeline.enrich.Enricher;
import com.openlead.intel.pipeline.model.AdapterRunSummary;
import com.openlead.intel.pipeline.model.BatchResult;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.PipelineRunStatus;
import com.openlead.intel.pipeline.model.PipelineStage;
import com.openlead.intel.pipeline.score.LeadScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs one pipeline pass: collect from every adapter in parallel, then deduplicate, enrich,
 * score and filter on the calling thread. A failing adapter or enricher only costs its own
 * output; the run carries on with everything else.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final long POLL_INTERVAL_MS = 100;

    private final CompanyDeduplicator deduplicator;
    private final LeadScorer scorer;
    private final ExecutorService adapterExecutor;
    private final PipelineProperties properties;

    public PipelineOrchestrator(
        CompanyDeduplicator deduplicator,
        LeadScorer scorer,
        @Qualifier("adapterExecutor") ExecutorService adapterExecutor,
        PipelineProperties properties
    ) {
        this.deduplicator = deduplicator;
        this.scorer = scorer;
        this.adapterExecutor = adapterExecutor;
        this.properties = properties;
    }

    public PipelineRunResult run(
        List<AdapterInvocation<?>> invocations,
        List<Enricher> enrichers,
        PipelineOptions options,
        RunCancellation cancellation
    ) {
        return run(UUID.randomUUID().toString(), invocations, enrichers, options, cancellation);
    }

    public PipelineRunResult run(
        String runId,
        List<AdapterInvocation<?>> invocations,
        List<Enricher> enrichers,
        PipelineOptions options,
        RunCancellation cancellation
    ) {
        Instant startedAt = Instant.now();
        RunCancellation control = cancellation == null ? RunCancellation.none() : cancellation;
        int maxDurationSeconds = properties.getRun().getMaxDurationSeconds();
        Instant deadline = maxDurationSeconds > 0 ? startedAt.plusSeconds(maxDurationSeconds) : null;
        RunState state = new RunState(runId, startedAt, control, deadline);

        log.info("Pipeline run {} starting with {} sources", runId, invocations.size());
        try {
            PipelineRunStatus status = execute(state, invocations, enrichers == null ? List.of() : enrichers, options);
            return state.finish(status, status.name().toLowerCase(Locale.ROOT));
        } catch (PipelineCancelledException e) {
            log.info("Pipeline run {} cancelled: {}", runId, e.getReason());
            state.companies = List.of();
            return state.finish(PipelineRunStatus.CANCELLED, e.getReason());
        } catch (Exception e) {
            log.error("Pipeline run {} failed", runId, e);
            state.companies = List.of();
            return state.finish(PipelineRunStatus.FAILED, "exception=" + e.getClass().getSimpleName());
        }
    }

    private PipelineRunStatus execute(
        RunState state,
        List<AdapterInvocation<?>> invocations,
        List<Enricher> enrichers,
        PipelineOptions options
    ) {
        state.enter(PipelineStage.COLLECTING);
        List<Company> collected = collect(state, invocations);
        state.collectedCount = collected.size();
        boolean allSourcesFailed = !invocations.isEmpty()
            && state.adapters.stream().noneMatch(AdapterRunSummary::succeeded);
        boolean anySourceFailed = state.adapters.stream().anyMatch(summary -> !summary.succeeded());
        if (collected.isEmpty()) {
            state.skipRemaining(PipelineStage.DEDUPLICATING);
            return allSourcesFailed ? PipelineRunStatus.ALL_SOURCES_FAILED : PipelineRunStatus.NO_RECORDS;
        }

        List<Company> companies = collected;
        state.checkCancelled();
        if (options.deduplicate()) {
            state.enter(PipelineStage.DEDUPLICATING);
            companies = deduplicator.deduplicate(companies);
        } else {
            state.skip(PipelineStage.DEDUPLICATING);
        }
        state.dedupedCount = companies.size();

        state.checkCancelled();
        boolean enrichmentFailed = false;
        if (options.enrich() && !enrichers.isEmpty()) {
            state.enter(PipelineStage.ENRICHING);
            enrichmentFailed = enrich(state, companies, enrichers);
        } else {
            state.skip(PipelineStage.ENRICHING);
        }

        state.checkCancelled();
        if (options.score()) {
            state.enter(PipelineStage.SCORING);
            companies = scorer.scoreAll(companies);
        } else {
            state.skip(PipelineStage.SCORING);
        }

        state.checkCancelled();
        if (options.filters()) {
            state.enter(PipelineStage.FILTERING);
            companies = filter(companies, options.minScoreThreshold());
        } else {
            state.skip(PipelineStage.FILTERING);
        }

        state.companies = List.copyOf(companies);
        return anySourceFailed || enrichmentFailed
            ? PipelineRunStatus.COMPLETED_WITH_ERRORS
            : PipelineRunStatus.COMPLETED;
    }

    private List<Company> collect(RunState state, List<AdapterInvocation<?>> invocations) {
        List<Company> aggregate = new ArrayList<>();
        if (invocations.isEmpty()) {
            return aggregate;
        }
        state.checkCancelled();
        CompletionService<BatchResult> completionService = new ExecutorCompletionService<>(adapterExecutor);
        Map<Future<BatchResult>, AdapterInvocation<?>> pending = new LinkedHashMap<>();
        try {
            for (AdapterInvocation<?> invocation : invocations) {
                pending.put(completionService.submit(() -> timed(invocation)), invocation);
            }
            int remaining = pending.size();
            while (remaining > 0) {
                state.checkCancelled();
                Future<BatchResult> done;
                try {
                    done = completionService.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    state.control.cancel(RunCancellation.INTERRUPTED);
                    throw new PipelineCancelledException(RunCancellation.INTERRUPTED);
                }
                if (done == null) {
                    continue;
                }
                remaining--;
                AdapterInvocation<?> invocation = pending.get(done);
                BatchResult batch = resolve(done, invocation);
                state.adapters.add(AdapterRunSummary.from(invocation.name(), batch));
                if (!batch.isSucceeded()) {
                    String errors = batch.getErrors().isEmpty() ? "unknown error" : String.join("; ", batch.getErrors());
                    log.warn("Source {} failed: {}", invocation.describe(), errors);
                    state.warnings.add(invocation.name() + " failed: " + errors);
                    continue;
                }
                for (String warning : batch.getWarnings()) {
                    state.warnings.add(invocation.name() + ": " + warning);
                }
                aggregate.addAll(batch.getRecords());
                log.info("Source {} returned {} records", invocation.describe(), batch.getRecords().size());
            }
        } finally {
            for (Future<BatchResult> future : pending.keySet()) {
                future.cancel(true);
            }
        }
        log.info("Collected {} records from {} sources", aggregate.size(), invocations.size());
        return aggregate;
    }

    private BatchResult timed(AdapterInvocation<?> invocation) {
        Instant startedAt = Instant.now();
        BatchResult result = invocation.execute();
        if (result != null && result.getElapsed().isZero()) {
            result.setElapsed(Duration.between(startedAt, Instant.now()));
        }
        return result;
    }

    private BatchResult resolve(Future<BatchResult> done, AdapterInvocation<?> invocation) {
        try {
            BatchResult result = done.get();
            if (result == null) {
                return BatchResult.failed(DataSource.OTHER, "adapter returned no result", Duration.ZERO);
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Source {} threw", invocation.describe(), cause);
            return BatchResult.failed(
                DataSource.OTHER,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                Duration.ZERO
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(RunCancellation.INTERRUPTED);
        }
    }

    private boolean enrich(RunState state, List<Company> companies, List<Enricher> enrichers) {
        boolean failed = false;
        for (Enricher enricher : enrichers) {
            state.checkCancelled();
            log.info("Enriching {} companies with {}", companies.size(), enricher.name());
            for (int i = 0; i < companies.size(); i++) {
                Company company = companies.get(i);
                try {
                    Company enriched = enricher.enrichRecord(company);
                    if (enriched != null) {
                        companies.set(i, enriched);
                    }
                } catch (RuntimeException e) {
                    failed = true;
                    log.warn("Enricher {} failed for {}", enricher.name(), company.getName(), e);
                    state.warnings.add(enricher.name() + " failed for " + company.getName() + ": " + e.getMessage());
                }
            }
        }
        return failed;
    }

    private List<Company> filter(List<Company> companies, double minScore) {
        List<Company> kept = new ArrayList<>();
        for (Company company : companies) {
            if (company.getScore() != null && company.getScore().getTotal() >= minScore) {
                kept.add(company);
            }
        }
        log.info("Filtered {} -> {} companies (min score {})", companies.size(), kept.size(), minScore);
        return kept;
    }

    private static final class RunState {
        private final String runId;
        private final Instant startedAt;
        private final RunCancellation control;
        private final Instant deadline;
        private final List<AdapterRunSummary> adapters = new ArrayList<>();
        private final List<PipelineStage> executed = new ArrayList<>();
        private final List<PipelineStage> skipped = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private List<Company> companies = List.of();
        private int collectedCount;
        private int dedupedCount;

        private RunState(String runId, Instant startedAt, RunCancellation control, Instant deadline) {
            this.runId = runId;
            this.startedAt = startedAt;
            this.control = control;
            this.deadline = deadline;
        }

        private void enter(PipelineStage stage) {
            log.info("Pipeline run {} stage {}", runId, stage);
            executed.add(stage);
        }

        private void skip(PipelineStage stage) {
            log.debug("Pipeline run {} skipping stage {}", runId, stage);
            skipped.add(stage);
        }

        private void skipRemaining(PipelineStage from) {
            PipelineStage[] stages = PipelineStage.values();
            for (int i = from.ordinal(); i < stages.length; i++) {
                if (stages[i] != PipelineStage.DONE) {
                    skip(stages[i]);
                }
            }
        }

        private void checkCancelled() {
            if (Thread.currentThread().isInterrupted()) {
                control.cancel(RunCancellation.INTERRUPTED);
            }
            if (deadline != null && Instant.now().isAfter(deadline)) {
                control.cancel(RunCancellation.TIME_BUDGET_EXCEEDED);
            }
            if (control.isCancelled()) {
                throw new PipelineCancelledException(control.reason());
            }
        }

        private PipelineRunResult finish(PipelineRunStatus status, String notes) {
            executed.add(PipelineStage.DONE);
            Instant finishedAt = Instant.now();
            log.info(
                "Pipeline run {} finished with status {} in {} ms: collected={} deduped={} final={} warnings={}",
                runId,
                status,
                Duration.between(startedAt, finishedAt).toMillis(),
                collectedCount,
                dedupedCount,
                companies.size(),
                warnings.size()
            );
            return new PipelineRunResult(
                runId,
                status,
                startedAt,
                finishedAt,
                collectedCount,
                dedupedCount,
                companies,
                List.copyOf(adapters),
                List.copyOf(executed),
                List.copyOf(skipped),
                List.copyOf(warnings),
                notes
            );
        }
    }
}
