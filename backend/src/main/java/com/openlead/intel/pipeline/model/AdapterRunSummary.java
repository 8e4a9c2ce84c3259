package com.openlead.intel.pipeline.model;

import java.time.Duration;
import java.util.List;

public record AdapterRunSummary(
    String adapter,
    DataSource source,
    boolean succeeded,
    int recordCount,
    List<String> errors,
    List<String> warnings,
    Duration elapsed) {

    public static AdapterRunSummary from(String adapter, BatchResult result) {
        return new AdapterRunSummary(
            adapter,
            result.getSource(),
            result.isSucceeded(),
            result.getRecords().size(),
            List.copyOf(result.getErrors()),
            List.copyOf(result.getWarnings()),
            result.getElapsed());
    }
}
