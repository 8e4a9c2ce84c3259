package com.openlead.intel.pipeline.dedup;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.service.PipelineConfigurationException;
import com.openlead.intel.pipeline.util.CompanyNames;
import com.openlead.intel.pipeline.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes duplicate companies, keeping the first occurrence. A record is a duplicate when its
 * normalized domain was already seen, or when its cleaned name is at least
 * {@code nameSimilarityThreshold} similar to any kept name. Every new name is compared against
 * every kept one, so a batch costs O(n²) comparisons.
 */
public class CompanyDeduplicator {
    public static final double DEFAULT_THRESHOLD = 0.85;

    private static final Logger log = LoggerFactory.getLogger(CompanyDeduplicator.class);

    private final double nameSimilarityThreshold;

    public CompanyDeduplicator() {
        this(DEFAULT_THRESHOLD);
    }

    public CompanyDeduplicator(double nameSimilarityThreshold) {
        if (Double.isNaN(nameSimilarityThreshold) || nameSimilarityThreshold <= 0.0 || nameSimilarityThreshold > 1.0) {
            throw new PipelineConfigurationException(
                "nameSimilarityThreshold must be in (0, 1], got " + nameSimilarityThreshold
            );
        }
        this.nameSimilarityThreshold = nameSimilarityThreshold;
    }

    public double getNameSimilarityThreshold() {
        return nameSimilarityThreshold;
    }

    public List<Company> deduplicate(List<Company> companies) {
        if (companies == null || companies.isEmpty()) {
            return new ArrayList<>();
        }
        List<Company> unique = new ArrayList<>();
        Set<String> seenDomains = new HashSet<>();
        List<String> seenNames = new ArrayList<>();

        for (Company company : companies) {
            String domain = DomainNames.normalize(company);
            if (domain != null && seenDomains.contains(domain)) {
                log.debug("Duplicate domain {} ({})", domain, company.getName());
                continue;
            }

            String cleanName = CompanyNames.normalize(company.getName());
            String similarTo = findSimilar(cleanName, seenNames);
            if (similarTo != null) {
                log.debug("Duplicate name {} ~ {}", company.getName(), similarTo);
                continue;
            }

            unique.add(company);
            if (domain != null) {
                seenDomains.add(domain);
            }
            seenNames.add(cleanName);
        }

        log.info(
            "Deduplication complete: {}/{} unique companies ({} duplicates removed)",
            unique.size(),
            companies.size(),
            companies.size() - unique.size()
        );
        return unique;
    }

    private String findSimilar(String cleanName, List<String> seenNames) {
        for (String seenName : seenNames) {
            if (SequenceMatcher.ratio(cleanName, seenName) >= nameSimilarityThreshold) {
                return seenName;
            }
        }
        return null;
    }
}
