package com.openlead.intel.pipeline.dedup;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.service.PipelineConfigurationException;
import com.openlead.intel.pipeline.util.DomainNames;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompanyDeduplicatorTest {
    private final CompanyDeduplicator deduplicator = new CompanyDeduplicator();

    @Test
    void collapsesSameDomainRegardlessOfSuffixPunctuation() {
        List<Company> unique = deduplicator.deduplicate(List.of(
            company("Example Inc", "example.com"),
            company("Example Inc.", "example.com")
        ));

        assertThat(unique).extracting(Company::getName).containsExactly("Example Inc");
    }

    @Test
    void collapsesSimilarNamesWithoutDomains() {
        List<Company> unique = deduplicator.deduplicate(List.of(
            company("Example Inc", null),
            company("Example Corporation", null)
        ));

        assertThat(unique).hasSize(1);
    }

    @Test
    void keepsDissimilarNames() {
        List<Company> unique = deduplicator.deduplicate(List.of(
            company("Example Inc", null),
            company("Different Corp", null)
        ));

        assertThat(unique).extracting(Company::getName).containsExactly("Example Inc", "Different Corp");
    }

    @Test
    void websiteHostMatchesExplicitDomain() {
        Company withDomain = company("Acme", "acme.com");
        Company withWebsite = new Company("Acme Rocket Sleds", DataSource.CRUNCHBASE);
        withWebsite.setWebsite("https://www.acme.com/about");

        assertThat(deduplicator.deduplicate(List.of(withDomain, withWebsite))).containsExactly(withDomain);
    }

    @Test
    void preservesFirstSeenOrder() {
        List<Company> unique = deduplicator.deduplicate(List.of(
            company("Globex", "globex.com"),
            company("Initech", "initech.com"),
            company("Globex LLC", "globex.net"),
            company("Umbrella", "umbrella.com")
        ));

        assertThat(unique).extracting(Company::getName).containsExactly("Globex", "Initech", "Umbrella");
    }

    @Test
    void outputIsIdempotentAndHasNoSharedDomains() {
        List<Company> input = new ArrayList<>(List.of(
            company("Acme", "acme.com"),
            company("ACME Inc", "www.acme.com"),
            company("Stark Industries", "stark.com"),
            company("Stark Industries Ltd", null),
            company("Wayne Enterprises", "wayne.com"),
            company("Tyrell", "acme.com"),
            company("Cyberdyne Systems", null)
        ));

        List<Company> once = deduplicator.deduplicate(input);
        List<Company> twice = deduplicator.deduplicate(once);

        assertThat(once.size()).isLessThanOrEqualTo(input.size());
        assertThat(twice).containsExactlyElementsOf(once);
        Set<String> domains = new HashSet<>();
        for (Company company : once) {
            String domain = DomainNames.normalize(company);
            if (domain != null) {
                assertThat(domains.add(domain)).as("domain %s seen twice", domain).isTrue();
            }
        }
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(deduplicator.deduplicate(List.of())).isEmpty();
        assertThat(deduplicator.deduplicate(null)).isEmpty();
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new CompanyDeduplicator(0.0)).isInstanceOf(PipelineConfigurationException.class);
        assertThatThrownBy(() -> new CompanyDeduplicator(1.5)).isInstanceOf(PipelineConfigurationException.class);
        assertThat(new CompanyDeduplicator(1.0).getNameSimilarityThreshold()).isEqualTo(1.0);
    }

    private Company company(String name, String domain) {
        Company company = new Company(name, DataSource.MANUAL);
        company.setDomain(domain);
        return company;
    }
}
