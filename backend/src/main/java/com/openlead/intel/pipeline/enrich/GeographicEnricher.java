package com.openlead.intel.pipeline.enrich;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.GeographicInfo;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class GeographicEnricher implements Enricher {
    public static final String NAME = "geographic";

    private static final String NORTH_AMERICA = "North America";
    private static final String EUROPE = "Europe";
    private static final Map<String, String> REGIONS = Map.of(
        "USA", NORTH_AMERICA,
        "United States", NORTH_AMERICA,
        "US", NORTH_AMERICA,
        "UK", EUROPE,
        "United Kingdom", EUROPE,
        "Germany", EUROPE,
        "France", EUROPE
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Company enrichRecord(Company company) {
        if (company.getEnrichment() == null || company.getEnrichment().getGeographicInfo() == null) {
            return company;
        }
        GeographicInfo geo = company.getEnrichment().getGeographicInfo();
        String country = geo.getCountry() == null ? null : geo.getCountry().trim();
        if (country != null && REGIONS.containsKey(country)) {
            geo.setRegion(REGIONS.get(country));
        }
        return company;
    }
}
