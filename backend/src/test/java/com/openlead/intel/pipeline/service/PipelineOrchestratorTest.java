package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.adapter.AdapterInvocation;
import com.openlead.intel.pipeline.adapter.SourceAdapter;
import com.openlead.intel.pipeline.dedup.CompanyDeduplicator;
import com.openlead.intel.pipeline.enrich.Enricher;
import com.openlead.intel.pipeline.model.BatchResult;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.CompanySize;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.model.HiringIntent;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.PipelineRunStatus;
import com.openlead.intel.pipeline.model.PipelineStage;
import com.openlead.intel.pipeline.score.LeadScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineOrchestratorTest {
    private static final List<String> NAMES = List.of(
        "Acme", "Globex", "Initech", "Umbrella", "Hooli", "Stark",
        "Wayne", "Wonka", "Tyrell", "Cyberdyne", "Soylent", "Aperture"
    );

    private ExecutorService executor;
    private PipelineProperties properties;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        properties = new PipelineProperties();
        orchestrator = new PipelineOrchestrator(new CompanyDeduplicator(), new LeadScorer(), executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failingAdapterDoesNotSinkTheRun() {
        List<AdapterInvocation<?>> invocations = List.of(
            invocation("first", () -> batch(NAMES.subList(0, 5))),
            invocation("broken", () -> {
                throw new IllegalStateException("boom");
            }),
            invocation("second", () -> batch(NAMES.subList(5, 12)))
        );

        PipelineRunResult result = orchestrator.run(
            invocations, List.of(), new PipelineOptions(true, false, false, 0.0), RunCancellation.none()
        );

        assertThat(result.status()).isEqualTo(PipelineRunStatus.COMPLETED_WITH_ERRORS);
        assertThat(result.failed()).isFalse();
        assertThat(result.collectedCount()).isEqualTo(12);
        assertThat(result.companies()).hasSize(12);
        assertThat(result.warnings()).singleElement().asString()
            .startsWith("broken failed:")
            .contains("IllegalStateException: boom");
        assertThat(result.adapters()).hasSize(3);
    }

    @Test
    void filtersByMinimumScoreAndSortsDescending() {
        List<AdapterInvocation<?>> invocations = List.of(invocation("leads", () -> {
            BatchResult batch = new BatchResult(DataSource.MANUAL);
            batch.addRecord(hiringCompany("Acme", 10, 5, 4.0, CompanySize.MEDIUM, 100, true));
            batch.addRecord(hiringCompany("Globex", 2, 0, 0.0, CompanySize.SMALL, 45, false));
            batch.addRecord(hiringCompany("Initech", 4, 1, 0.0, CompanySize.SMALL, 45, true));
            batch.addRecord(new Company("Umbrella", DataSource.MANUAL));
            return batch;
        }));

        PipelineRunResult result = orchestrator.run(
            invocations, List.of(), new PipelineOptions(true, false, true, 50.0), RunCancellation.none()
        );

        assertThat(result.status()).isEqualTo(PipelineRunStatus.COMPLETED);
        assertThat(result.companies()).extracting(Company::getName).containsExactly("Acme", "Initech");
        assertThat(result.companies().get(0).getScore().getTotal()).isEqualTo(72.5);
        assertThat(result.companies().get(1).getScore().getTotal()).isEqualTo(55.5);
        assertThat(result.stagesExecuted()).containsExactly(
            PipelineStage.COLLECTING,
            PipelineStage.DEDUPLICATING,
            PipelineStage.SCORING,
            PipelineStage.FILTERING,
            PipelineStage.DONE
        );
        assertThat(result.stagesSkipped()).containsExactly(PipelineStage.ENRICHING);
    }

    @Test
    void cancellationStopsCollectionAndInterruptsAdapters() throws Exception {
        RunCancellation cancellation = new RunCancellation();
        CountDownLatch neverReleased = new CountDownLatch(1);
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        List<AdapterInvocation<?>> invocations = List.of(
            invocation("quick", () -> {
                try {
                    slowStarted.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                cancellation.cancel("user_requested");
                return batch(NAMES.subList(0, 2));
            }),
            invocation("slow", () -> {
                slowStarted.countDown();
                try {
                    neverReleased.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return batch(NAMES.subList(2, 4));
            })
        );

        PipelineRunResult result = orchestrator.run(invocations, List.of(), PipelineOptions.defaults(), cancellation);

        assertThat(result.status()).isEqualTo(PipelineRunStatus.CANCELLED);
        assertThat(result.companies()).isEmpty();
        assertThat(result.notes()).isEqualTo("user_requested");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void timeBudgetCancelsSlowRun() {
        properties.getRun().setMaxDurationSeconds(1);
        CountDownLatch neverReleased = new CountDownLatch(1);
        List<AdapterInvocation<?>> invocations = List.of(invocation("slow", () -> {
            try {
                neverReleased.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return batch(NAMES.subList(0, 1));
        }));

        PipelineRunResult result = orchestrator.run(invocations, List.of(), PipelineOptions.defaults(), null);

        assertThat(result.status()).isEqualTo(PipelineRunStatus.CANCELLED);
        assertThat(result.notes()).isEqualTo(RunCancellation.TIME_BUDGET_EXCEEDED);
    }

    @Test
    void enricherFailureIsIsolatedPerRecord() {
        List<AdapterInvocation<?>> invocations = List.of(invocation("leads", () -> batch(NAMES.subList(0, 3))));
        Enricher flaky = enricher("flaky", company -> {
            if ("Globex".equals(company.getName())) {
                throw new IllegalArgumentException("bad page");
            }
            company.enrichmentOrCreate().getTags().add("flaky-ok");
        });
        Enricher tagger = enricher("tagger", company -> company.enrichmentOrCreate().getTags().add("tagged"));

        PipelineRunResult result = orchestrator.run(
            invocations, List.of(flaky, tagger), new PipelineOptions(true, true, false, 0.0), RunCancellation.none()
        );

        assertThat(result.status()).isEqualTo(PipelineRunStatus.COMPLETED_WITH_ERRORS);
        assertThat(result.companies()).hasSize(3);
        assertThat(result.warnings()).containsExactly("flaky failed for Globex: bad page");
        assertThat(result.companies())
            .allSatisfy(company -> assertThat(company.getEnrichment().getTags()).contains("tagged"));
    }

    @Test
    void everySourceFailingIsReportedAsFailure() {
        List<AdapterInvocation<?>> invocations = List.of(
            invocation("a", () -> BatchResult.failed(DataSource.MANUAL, "Could not load a", null)),
            invocation("b", () -> BatchResult.failed(DataSource.MANUAL, "Could not load b", null))
        );

        PipelineRunResult result = orchestrator.run(invocations, List.of(), PipelineOptions.defaults(), null);

        assertThat(result.status()).isEqualTo(PipelineRunStatus.ALL_SOURCES_FAILED);
        assertThat(result.failed()).isTrue();
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.stagesSkipped()).containsExactly(
            PipelineStage.DEDUPLICATING,
            PipelineStage.ENRICHING,
            PipelineStage.SCORING,
            PipelineStage.FILTERING
        );
    }

    @Test
    void emptySourcesAreNotAFailure() {
        List<AdapterInvocation<?>> invocations = List.of(invocation("empty", () -> new BatchResult(DataSource.MANUAL)));

        PipelineRunResult result = orchestrator.run(invocations, List.of(), PipelineOptions.defaults(), null);

        assertThat(result.status()).isEqualTo(PipelineRunStatus.NO_RECORDS);
        assertThat(result.failed()).isFalse();
        assertThat(result.companies()).isEmpty();
    }

    @Test
    void disabledStagesAreSkipped() {
        List<AdapterInvocation<?>> invocations = List.of(invocation("leads", () -> batch(NAMES.subList(0, 2))));

        PipelineRunResult result = orchestrator.run(
            invocations, List.of(), new PipelineOptions(false, false, false, 0.0), null
        );

        assertThat(result.stagesExecuted()).containsExactly(PipelineStage.COLLECTING, PipelineStage.DONE);
        assertThat(result.companies()).allSatisfy(company -> assertThat(company.getScore()).isNull());
    }

    private BatchResult batch(List<String> names) {
        BatchResult batch = new BatchResult(DataSource.MANUAL);
        for (String name : names) {
            Company company = new Company(name, DataSource.MANUAL);
            company.setDomain(name.toLowerCase(Locale.ROOT) + ".com");
            batch.addRecord(company);
        }
        return batch;
    }

    private Company hiringCompany(
        String name,
        int openPositions,
        int recentPostings,
        double velocity,
        CompanySize size,
        int employees,
        boolean withDescription
    ) {
        Company company = new Company(name, DataSource.MANUAL);
        company.setWebsite("https://" + name.toLowerCase(Locale.ROOT) + ".com");
        if (withDescription) {
            company.setDescription(name + " builds software");
        }
        CompanyEnrichment enrichment = company.enrichmentOrCreate();
        enrichment.setCompanySize(size);
        enrichment.setEmployeeCount(employees);
        HiringIntent hiring = new HiringIntent();
        hiring.setHiring(true);
        hiring.setTotalOpenPositions(openPositions);
        hiring.setRecentPostings(recentPostings);
        hiring.setHiringVelocity(velocity);
        enrichment.setHiringIntent(hiring);
        return company;
    }

    private AdapterInvocation<String> invocation(String name, Supplier<BatchResult> body) {
        return AdapterInvocation.of(new StubAdapter(name, body), name + "-config");
    }

    private Enricher enricher(String name, Consumer<Company> action) {
        return new Enricher() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Company enrichRecord(Company company) {
                action.accept(company);
                return company;
            }
        };
    }

    private static final class StubAdapter implements SourceAdapter<String, String> {
        private final String name;
        private final Supplier<BatchResult> body;

        private StubAdapter(String name, Supplier<BatchResult> body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public BatchResult scrape(String config) {
            return body.get();
        }

        @Override
        public Company parseRecord(String raw) {
            return new Company(raw, DataSource.OTHER);
        }
    }
}
