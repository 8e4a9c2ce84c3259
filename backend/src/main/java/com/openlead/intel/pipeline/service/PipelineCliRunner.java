package com.openlead.intel.pipeline.service;

import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.export.CompanyExporter;
import com.openlead.intel.pipeline.export.ExportFormat;
import com.openlead.intel.pipeline.model.AdapterRunSummary;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.PipelineRunRequest;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);
    private static final int TOP_COMPANIES = 5;

    private final PipelineProperties properties;
    private final PipelineRunService runService;
    private final CompanyExporter exporter;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        PipelineRunService runService,
        CompanyExporter exporter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.exporter = exporter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        PipelineProperties.Cli cli = properties.getCli();
        PipelineRunRequest request = new PipelineRunRequest(
            splitList(cli.getListingUrls()),
            splitList(cli.getCsvFiles()),
            null,
            null,
            null,
            null,
            cli.getMaxRecordsPerSource(),
            null
        );

        int exitCode = 0;
        try {
            PipelineRunResult result = runService.run(request);
            report(result);
            export(result.companies(), cli.getOutputFormat(), cli.getOutputFile());
            exitCode = result.failed() ? 1 : 0;
        } catch (PipelineConfigurationException e) {
            log.error("Invalid pipeline configuration: {}", e.getMessage());
            exitCode = 2;
        } catch (IOException e) {
            log.error("Export failed", e);
            exitCode = 1;
        }

        if (cli.isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }

    private void report(PipelineRunResult result) {
        log.info(
            "Pipeline run {} completed with status {}: collected={}, unique={}, final={}",
            result.runId(),
            result.status(),
            result.collectedCount(),
            result.dedupedCount(),
            result.companies().size()
        );
        for (AdapterRunSummary adapter : result.adapters()) {
            log.info(
                "Source {}: succeeded={}, records={}, elapsed={}ms, errors={}",
                adapter.adapter(),
                adapter.succeeded(),
                adapter.recordCount(),
                adapter.elapsed().toMillis(),
                adapter.errors()
            );
        }
        for (String warning : result.warnings()) {
            log.warn("Run warning: {}", warning);
        }

        Map<Priority, Integer> breakdown = new EnumMap<>(Priority.class);
        for (Company company : result.companies()) {
            if (company.getScore() != null) {
                breakdown.merge(company.getScore().getPriority(), 1, Integer::sum);
            }
        }
        log.info(
            "Priority breakdown: high={}, medium={}, low={}",
            breakdown.getOrDefault(Priority.HIGH, 0),
            breakdown.getOrDefault(Priority.MEDIUM, 0),
            breakdown.getOrDefault(Priority.LOW, 0)
        );
        List<Company> top = result.companies().subList(0, Math.min(TOP_COMPANIES, result.companies().size()));
        for (int i = 0; i < top.size(); i++) {
            Company company = top.get(i);
            log.info(
                "Top {}: {} score={} domain={}",
                i + 1,
                company.getName(),
                company.getScore() == null ? "n/a" : company.getScore(),
                company.getDomain()
            );
        }
    }

    private void export(List<Company> companies, String outputFormat, String outputFile) throws IOException {
        String format = outputFormat == null ? "csv" : outputFormat.trim().toLowerCase(Locale.ROOT);
        List<ExportFormat> formats = "all".equals(format)
            ? List.of(ExportFormat.values())
            : List.of(ExportFormat.fromRaw(format));
        for (ExportFormat exportFormat : formats) {
            Path written = exporter.export(companies, exportFormat, outputFile);
            if (written != null) {
                log.info("Wrote {} companies to {}", companies.size(), written);
            }
        }
    }

    private List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
