package com.openlead.intel.pipeline.export;

import com.openlead.intel.pipeline.model.Company;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface CompanyExporter {
    /**
     * Writes {@code companies} in the given format and returns the written file, or null when
     * there was nothing to write. A null or blank {@code baseName} gets a timestamped default.
     */
    Path export(List<Company> companies, ExportFormat format, String baseName) throws IOException;
}
