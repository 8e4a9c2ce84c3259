package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.service.PipelineConfigurationException;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw listing URLs and CSV paths into validated adapter invocations.
 */
@Component
public class SourceAdapterFactory {
    private final GenericListingAdapter listingAdapter;
    private final CsvFileAdapter csvFileAdapter;

    public SourceAdapterFactory(GenericListingAdapter listingAdapter, CsvFileAdapter csvFileAdapter) {
        this.listingAdapter = listingAdapter;
        this.csvFileAdapter = csvFileAdapter;
    }

    public List<AdapterInvocation<?>> invocations(List<String> listingUrls, List<String> csvFiles, int maxRecords) {
        List<AdapterInvocation<?>> out = new ArrayList<>();
        if (listingUrls != null) {
            for (String url : listingUrls) {
                out.add(listing(url, maxRecords));
            }
        }
        if (csvFiles != null) {
            for (String file : csvFiles) {
                out.add(csvFile(file, maxRecords));
            }
        }
        return out;
    }

    public AdapterInvocation<GenericListingConfig> listing(String url, int maxRecords) {
        return AdapterInvocation.of(listingAdapter, new GenericListingConfig(url, maxRecords));
    }

    public AdapterInvocation<CsvFileConfig> csvFile(String file, int maxRecords) {
        if (file == null || file.isBlank()) {
            throw new PipelineConfigurationException("csv path must not be blank");
        }
        Path path;
        try {
            path = Paths.get(file.trim());
        } catch (InvalidPathException e) {
            throw new PipelineConfigurationException("malformed csv path: " + file, e);
        }
        return AdapterInvocation.of(csvFileAdapter, new CsvFileConfig(path, DataSource.MANUAL, maxRecords));
    }
}
