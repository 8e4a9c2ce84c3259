package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.model.BatchResult;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.CompanySize;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.model.GeographicInfo;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads companies from a header-first CSV file. Header names are matched case-insensitively.
 */
@Component
public class CsvFileAdapter implements SourceAdapter<CsvFileConfig, CsvFileAdapter.CsvRow> {
    public static final String NAME = "csv-file";

    private static final Logger log = LoggerFactory.getLogger(CsvFileAdapter.class);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult scrape(CsvFileConfig config) {
        Instant startedAt = Instant.now();
        BatchResult result = new BatchResult(config.source());
        Path path = resolvePath(config.path());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                if (result.getRecords().size() >= config.maxRecords()) {
                    break;
                }
                Company company = parseRecord(new CsvRow(record, config.source(), path.toString()));
                if (company == null) {
                    result.addWarning("csv row " + record.getRecordNumber() + " in " + path.getFileName() + " has no company name");
                    continue;
                }
                result.addRecord(company);
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            log.warn("Failed to read CSV at {}", path, e);
            result.addError("failed to read CSV at " + path + ": " + rootMessage(e));
        } finally {
            result.setElapsed(Duration.between(startedAt, Instant.now()));
        }
        log.info("Read {} companies from {}", result.getRecords().size(), path);
        return result;
    }

    @Override
    public Company parseRecord(CsvRow row) {
        CSVRecord record = row.record();
        String name = getColumn(record, "name", "company_name", "company");
        if (name == null) {
            return null;
        }
        Company company = new Company(name, row.source());
        company.setSourceUrl(row.origin());
        company.setDomain(getColumn(record, "domain"));
        company.setWebsite(getColumn(record, "website", "url"));
        company.setDescription(getColumn(record, "description"));

        String industry = getColumn(record, "industry");
        Integer employeeCount = parseCount(getColumn(record, "employee_count", "employees"));
        String country = getColumn(record, "country");
        String city = getColumn(record, "city");
        if (industry != null || employeeCount != null || country != null || city != null) {
            CompanyEnrichment enrichment = company.enrichmentOrCreate();
            enrichment.setIndustry(industry);
            if (employeeCount != null) {
                enrichment.setEmployeeCount(employeeCount);
                enrichment.setCompanySize(CompanySize.fromEmployeeCount(employeeCount));
            }
            if (country != null || city != null) {
                GeographicInfo geo = new GeographicInfo();
                geo.setCountry(country);
                geo.setCity(city);
                enrichment.setGeographicInfo(geo);
            }
        }
        return company;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Integer parseCount(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.replace(",", "").trim());
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric employee count '{}'", raw);
            return null;
        }
    }

    private Path resolvePath(Path configuredPath) {
        if (configuredPath.isAbsolute()) {
            return configuredPath.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(configuredPath).normalize();
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }

    /**
     * One CSV line together with the source it is attributed to.
     */
    public record CsvRow(CSVRecord record, DataSource source, String origin) {
    }
}
