package com.openlead.intel.pipeline.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class Company {
    private final String name;
    private final DataSource source;
    private String domain;
    private String website;
    private String description;
    private String sourceUrl;
    private CompanyEnrichment enrichment;
    private LeadScore score;
    private Instant scrapedAt;
    private Instant updatedAt;
    private final Map<String, Object> extraData = new LinkedHashMap<>();

    public Company(String name, DataSource source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("company name must not be blank");
        }
        this.name = name.trim();
        this.source = source == null ? DataSource.OTHER : source;
        Instant now = Instant.now();
        this.scrapedAt = now;
        this.updatedAt = now;
    }

    public String getName() {
        return name;
    }

    public DataSource getSource() {
        return source;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain == null || domain.isBlank() ? null : domain.trim().toLowerCase(Locale.ROOT);
    }

    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = blankToNull(website);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = blankToNull(description);
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = blankToNull(sourceUrl);
    }

    public CompanyEnrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(CompanyEnrichment enrichment) {
        this.enrichment = enrichment;
    }

    /**
     * Returns the attached enrichment, creating an empty one first if none exists.
     */
    public CompanyEnrichment enrichmentOrCreate() {
        if (enrichment == null) {
            enrichment = new CompanyEnrichment();
        }
        return enrichment;
    }

    public LeadScore getScore() {
        return score;
    }

    public void setScore(LeadScore score) {
        this.score = score;
    }

    public Instant getScrapedAt() {
        return scrapedAt;
    }

    public void setScrapedAt(Instant scrapedAt) {
        this.scrapedAt = scrapedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    public Map<String, Object> getExtraData() {
        return extraData;
    }

    public boolean hasWebPresence() {
        return website != null || domain != null;
    }

    @Override
    public String toString() {
        return name + (domain == null ? "" : " (" + domain + ")");
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
