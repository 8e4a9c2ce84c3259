package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.adapter.CsvFileAdapter;
import com.openlead.intel.pipeline.adapter.GenericListingAdapter;
import com.openlead.intel.pipeline.adapter.GenericListingConfig;
import com.openlead.intel.pipeline.adapter.SourceAdapterFactory;
import com.openlead.intel.pipeline.enrich.CompanySizeEstimator;
import com.openlead.intel.pipeline.enrich.EnricherRegistry;
import com.openlead.intel.pipeline.enrich.GeographicEnricher;
import com.openlead.intel.pipeline.model.PipelineRunRequest;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.PipelineRunStartResponse;
import com.openlead.intel.pipeline.model.PipelineRunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunServiceTest {
    private static final String LISTING = "https://example.com/top-startups";

    @Mock
    private PipelineOrchestrator orchestrator;
    @Mock
    private GenericListingAdapter listingAdapter;
    @Mock
    private CsvFileAdapter csvFileAdapter;

    private final CompanySizeEstimator sizeEstimator = new CompanySizeEstimator();
    private final GeographicEnricher geographicEnricher = new GeographicEnricher();
    private ExecutorService executor;
    private PipelineRunService service;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getEnrichment().setEnrichers(List.of("company-size", "geographic"));
        executor = Executors.newSingleThreadExecutor();
        service = new PipelineRunService(
            orchestrator,
            new SourceAdapterFactory(listingAdapter, csvFileAdapter),
            new EnricherRegistry(List.of(sizeEstimator, geographicEnricher)),
            properties,
            executor
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void requestWithoutSourcesIsRejected() {
        PipelineRunRequest request = new PipelineRunRequest(List.of(" "), null, null, null, null, null, null, null);

        assertThatThrownBy(() -> service.run(request)).isInstanceOf(PipelineConfigurationException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void unsetRequestFieldsFallBackToProperties() {
        PipelineRunService.ResolvedRun resolved = service.resolve(
            new PipelineRunRequest(List.of(LISTING), null, null, null, null, null, null, null)
        );

        assertThat(resolved.options()).isEqualTo(new PipelineOptions(true, true, true, 0.0));
        assertThat(resolved.enrichers()).containsExactly(sizeEstimator, geographicEnricher);
        assertThat(resolved.invocations()).hasSize(1);
        assertThat(resolved.invocations().get(0).config()).isEqualTo(new GenericListingConfig(LISTING, 20));
    }

    @Test
    void unknownEnricherIsRejectedOnlyWhenEnrichmentRuns() {
        PipelineRunRequest enriching = new PipelineRunRequest(
            List.of(LISTING), null, null, true, null, null, null, List.of("tech-stack")
        );
        PipelineRunRequest notEnriching = new PipelineRunRequest(
            List.of(LISTING), null, null, false, null, null, 5, List.of("tech-stack")
        );

        assertThatThrownBy(() -> service.resolve(enriching)).isInstanceOf(PipelineConfigurationException.class);
        assertThat(service.resolve(notEnriching).enrichers()).isEmpty();
    }

    @Test
    void outOfRangeMinScoreIsRejected() {
        PipelineRunRequest request = new PipelineRunRequest(
            List.of(LISTING), null, null, null, null, 120.0, null, null
        );

        assertThatThrownBy(() -> service.resolve(request)).isInstanceOf(PipelineConfigurationException.class);
    }

    @Test
    void synchronousRunIsTracked() {
        when(orchestrator.run(anyString(), anyList(), anyList(), any(), any()))
            .thenAnswer(invocation -> completed(invocation.getArgument(0)));

        PipelineRunResult result = service.run(
            new PipelineRunRequest(List.of(LISTING), null, null, null, null, null, null, null)
        );

        assertThat(result.status()).isEqualTo(PipelineRunStatus.COMPLETED);
        assertThat(service.find(result.runId())).contains(result);
    }

    @Test
    void onlyOneAsyncRunAtATimeAndItCanBeCancelled() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<RunCancellation> seenCancellation = new AtomicReference<>();
        when(orchestrator.run(anyString(), anyList(), anyList(), any(), any())).thenAnswer(invocation -> {
            seenCancellation.set(invocation.getArgument(4));
            release.await(5, TimeUnit.SECONDS);
            return completed(invocation.getArgument(0));
        });
        PipelineRunRequest request = new PipelineRunRequest(List.of(LISTING), null, null, null, null, null, null, null);

        PipelineRunStartResponse started = service.startAsync(request);

        assertThat(started.status()).isEqualTo(PipelineRunStatus.RUNNING);
        assertThat(started.statusUrl()).isEqualTo("/api/pipeline/runs/" + started.runId());
        assertThatThrownBy(() -> service.startAsync(request))
            .isInstanceOf(ActivePipelineRunException.class)
            .hasMessageContaining(started.runId());

        assertThat(service.cancel(started.runId()))
            .hasValueSatisfying(result -> assertThat(result.status()).isEqualTo(PipelineRunStatus.RUNNING));

        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seenCancellation.get().isCancelled()).isTrue();
        assertThat(service.find(started.runId()))
            .hasValueSatisfying(result -> assertThat(result.status()).isEqualTo(PipelineRunStatus.COMPLETED));
    }

    @Test
    void finishedRunsAreEvictedWhileAnOlderRunIsStillInProgress() throws Exception {
        Thread caller = Thread.currentThread();
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run(anyString(), anyList(), anyList(), any(), any())).thenAnswer(invocation -> {
            if (Thread.currentThread() != caller) {
                release.await(5, TimeUnit.SECONDS);
            }
            return completed(invocation.getArgument(0));
        });
        PipelineRunRequest request = new PipelineRunRequest(List.of(LISTING), null, null, null, null, null, null, null);

        PipelineRunStartResponse longRunning = service.startAsync(request);
        String firstFinished = service.run(request).runId();
        for (int i = 0; i < 110; i++) {
            service.run(request);
        }

        assertThat(service.trackedRunCount()).isEqualTo(100);
        assertThat(service.find(firstFinished)).isEmpty();
        assertThat(service.find(longRunning.runId()))
            .hasValueSatisfying(result -> assertThat(result.status()).isEqualTo(PipelineRunStatus.RUNNING));

        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void unknownRunsAreEmpty() {
        assertThat(service.find("missing")).isEmpty();
        assertThat(service.cancel("missing")).isEmpty();
    }

    private PipelineRunResult completed(String runId) {
        Instant now = Instant.now();
        return new PipelineRunResult(
            runId,
            PipelineRunStatus.COMPLETED,
            now,
            now,
            1,
            1,
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            "completed"
        );
    }
}
