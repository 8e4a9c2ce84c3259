package com.openlead.intel.pipeline.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class BatchResult {
    private final DataSource source;
    private final List<Company> records = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean succeeded = true;
    private Duration elapsed = Duration.ZERO;

    public BatchResult(DataSource source) {
        this.source = source == null ? DataSource.OTHER : source;
    }

    public static BatchResult failed(DataSource source, String error, Duration elapsed) {
        BatchResult result = new BatchResult(source);
        result.addError(error);
        result.setElapsed(elapsed);
        return result;
    }

    public void addRecord(Company company) {
        records.add(company);
    }

    public void addError(String error) {
        errors.add(error);
        succeeded = false;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public DataSource getSource() {
        return source;
    }

    public List<Company> getRecords() {
        return records;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public void setElapsed(Duration elapsed) {
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }
}
