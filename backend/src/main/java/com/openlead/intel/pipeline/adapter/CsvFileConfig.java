package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.service.PipelineConfigurationException;

import java.nio.file.Path;

public record CsvFileConfig(Path path, DataSource source, int maxRecords) {
    public CsvFileConfig {
        if (path == null || path.toString().isBlank()) {
            throw new PipelineConfigurationException("csv path must not be blank");
        }
        if (source == null) {
            source = DataSource.MANUAL;
        }
        if (maxRecords <= 0) {
            throw new PipelineConfigurationException("maxRecords must be > 0");
        }
    }
}
