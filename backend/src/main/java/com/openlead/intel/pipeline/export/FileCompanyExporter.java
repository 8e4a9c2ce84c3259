package com.openlead.intel.pipeline.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlead.intel.config.PipelineProperties;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.FundingInfo;
import com.openlead.intel.pipeline.model.GeographicInfo;
import com.openlead.intel.pipeline.model.HiringIntent;
import com.openlead.intel.pipeline.model.LeadScore;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class FileCompanyExporter implements CompanyExporter {
    static final List<String> CSV_COLUMNS = List.of(
        "company_name",
        "domain",
        "website",
        "description",
        "source",
        "source_url",
        "scraped_at",
        "employee_count",
        "company_size",
        "founded_year",
        "industry",
        "country",
        "city",
        "funding_stage",
        "total_funding",
        "open_positions",
        "is_hiring",
        "technologies",
        "total_score",
        "priority"
    );

    private static final Logger log = LoggerFactory.getLogger(FileCompanyExporter.class);
    private static final DateTimeFormatter BASE_NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_TECHNOLOGIES = 10;

    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public FileCompanyExporter(PipelineProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Path export(List<Company> companies, ExportFormat format, String baseName) throws IOException {
        if (companies == null || companies.isEmpty()) {
            log.warn("No companies to export");
            return null;
        }
        Path outputDir = Paths.get(properties.getExport().getOutputDir());
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(stem(baseName) + "." + format.extension());
        log.info("Exporting {} companies to {}", companies.size(), target);
        switch (format) {
            case CSV -> writeCsv(companies, target);
            case JSON -> writeJson(companies, target);
            default -> throw new IllegalStateException("Unhandled export format " + format);
        }
        log.info("Export completed: {}", target);
        return target;
    }

    static Map<String, Object> flatten(Company company) {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("company_name", company.getName());
        flat.put("domain", company.getDomain());
        flat.put("website", company.getWebsite());
        flat.put("description", company.getDescription());
        flat.put("source", lower(company.getSource()));
        flat.put("source_url", company.getSourceUrl());
        flat.put("scraped_at", company.getScrapedAt() == null ? null : company.getScrapedAt().toString());

        CompanyEnrichment enrichment = company.getEnrichment();
        if (enrichment != null) {
            flat.put("employee_count", enrichment.getEmployeeCount());
            flat.put("company_size", lower(enrichment.getCompanySize()));
            flat.put("founded_year", enrichment.getFoundedYear());
            flat.put("industry", enrichment.getIndustry());
            GeographicInfo geo = enrichment.getGeographicInfo();
            if (geo != null) {
                flat.put("country", geo.getCountry());
                flat.put("city", geo.getCity());
            }
            FundingInfo funding = enrichment.getFundingInfo();
            if (funding != null) {
                flat.put("funding_stage", lower(funding.getStage()));
                flat.put("total_funding", funding.getTotalFunding());
            }
            HiringIntent hiring = enrichment.getHiringIntent();
            if (hiring != null) {
                flat.put("open_positions", hiring.getTotalOpenPositions());
                flat.put("is_hiring", hiring.isHiring());
            }
            if (enrichment.getTechStack() != null) {
                List<String> technologies = enrichment.getTechStack().allTechnologies();
                flat.put(
                    "technologies",
                    String.join(", ", technologies.subList(0, Math.min(MAX_TECHNOLOGIES, technologies.size())))
                );
            }
        }

        LeadScore score = company.getScore();
        if (score != null) {
            flat.put("total_score", score.getTotal());
            flat.put("priority", lower(score.getPriority()));
        }
        return flat;
    }

    private void writeCsv(List<Company> companies, Path target) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_COLUMNS.toArray(new String[0]))
            .build();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Company company : companies) {
                Map<String, Object> flat = flatten(company);
                for (String column : CSV_COLUMNS) {
                    printer.print(flat.get(column));
                }
                printer.println();
            }
        }
    }

    private void writeJson(List<Company> companies, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, companies);
        }
    }

    private String stem(String baseName) {
        if (baseName == null || baseName.isBlank()) {
            return "companies_" + LocalDateTime.now().format(BASE_NAME_TIMESTAMP);
        }
        String fileName = Paths.get(baseName.trim()).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String lower(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }
}
