package com.openlead.intel.pipeline.model;

import java.util.ArrayList;
import java.util.List;

public record PipelineRunRequest(
    List<String> listingUrls,
    List<String> csvFiles,
    Boolean deduplicate,
    Boolean enrich,
    Boolean score,
    Double minScore,
    Integer maxRecordsPerSource,
    List<String> enrichers
) {
    public List<String> normalizedListingUrls() {
        return trimmed(listingUrls);
    }

    public List<String> normalizedCsvFiles() {
        return trimmed(csvFiles);
    }

    private static List<String> trimmed(List<String> values) {
        if (values == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String normalized = value.trim();
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return out;
    }
}
