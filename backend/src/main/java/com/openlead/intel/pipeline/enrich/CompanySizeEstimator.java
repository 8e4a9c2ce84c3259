package com.openlead.intel.pipeline.enrich;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.CompanySize;
import com.openlead.intel.pipeline.model.HiringIntent;
import org.springframework.stereotype.Component;

/**
 * Fills in an unknown company size from the employee count, or failing that from the number
 * of open positions.
 */
@Component
public class CompanySizeEstimator implements Enricher {
    public static final String NAME = "company-size";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Company enrichRecord(Company company) {
        CompanyEnrichment enrichment = company.enrichmentOrCreate();
        if (enrichment.getCompanySize() != CompanySize.UNKNOWN) {
            return company;
        }
        Integer employees = enrichment.getEmployeeCount();
        if (employees != null && employees > 0) {
            enrichment.setCompanySize(CompanySize.fromEmployeeCount(employees));
            return company;
        }
        HiringIntent intent = enrichment.getHiringIntent();
        if (intent != null && intent.getTotalOpenPositions() > 0) {
            enrichment.setCompanySize(fromOpenPositions(intent.getTotalOpenPositions()));
        }
        return company;
    }

    private CompanySize fromOpenPositions(int openPositions) {
        if (openPositions > 50) {
            return CompanySize.LARGE;
        }
        if (openPositions > 10) {
            return CompanySize.MEDIUM;
        }
        return CompanySize.SMALL;
    }
}
