package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.model.BatchResult;
import com.openlead.intel.pipeline.model.Company;

/**
 * Collects company records from one kind of source.
 *
 * @param <C> typed, validated configuration for a single invocation
 * @param <T> raw item produced by the source before it becomes a {@link Company}
 */
public interface SourceAdapter<C, T> {
    String name();

    /**
     * Runs one collection pass. Failures are reported as errors on the returned batch
     * rather than thrown.
     */
    BatchResult scrape(C config);

    /**
     * Converts a raw item into a record, or returns null when the item is unusable.
     */
    Company parseRecord(T raw);
}
