package com.openlead.intel.pipeline.export;

import com.openlead.intel.pipeline.service.PipelineConfigurationException;

import java.util.Locale;

public enum ExportFormat {
    CSV("csv"),
    JSON("json");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static ExportFormat fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return CSV;
        }
        try {
            return ExportFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("unsupported export format '" + raw + "'", e);
        }
    }
}
