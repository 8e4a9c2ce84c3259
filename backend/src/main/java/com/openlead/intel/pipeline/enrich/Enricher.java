package com.openlead.intel.pipeline.enrich;

import com.openlead.intel.pipeline.model.Company;

/**
 * Adds derived facts to a company. Implementations mutate the record in place and return it.
 */
public interface Enricher {
    String name();

    Company enrichRecord(Company company);
}
