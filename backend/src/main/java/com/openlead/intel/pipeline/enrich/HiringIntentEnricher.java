package com.openlead.intel.pipeline.enrich;

import com.openlead.intel.pipeline.http.PoliteHttpClient;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.HiringIntent;
import com.openlead.intel.pipeline.model.HttpFetchResult;
import com.openlead.intel.pipeline.model.JobPostingSignal;
import com.openlead.intel.pipeline.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Derives hiring intent from the job postings a company publishes on its own careers page.
 * Companies that already carry hiring intent are left untouched.
 */
@Component
public class HiringIntentEnricher implements Enricher {
    public static final String NAME = "hiring-intent";

    static final int RECENT_WINDOW_DAYS = 30;
    static final int VELOCITY_WINDOW_DAYS = 90;

    private static final Logger log = LoggerFactory.getLogger(HiringIntentEnricher.class);
    private static final List<String> CAREERS_PATHS = List.of("/careers", "/jobs");
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final List<String> ENGINEERING_KEYWORDS = List.of(
        "engineer", "developer", "software", "devops", "sre", "programmer", "architect", "data scientist"
    );
    private static final List<String> SALES_KEYWORDS = List.of(
        "sales", "account executive", "account manager", "business development", "sdr", "bdr"
    );
    private static final List<String> MARKETING_KEYWORDS = List.of(
        "marketing", "growth", "content", "seo", "brand", "communications"
    );

    private final PoliteHttpClient httpClient;
    private final JobPostingExtractor extractor;

    public HiringIntentEnricher(PoliteHttpClient httpClient, JobPostingExtractor extractor) {
        this.httpClient = httpClient;
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Company enrichRecord(Company company) {
        if (company.getEnrichment() != null && company.getEnrichment().getHiringIntent() != null) {
            return company;
        }
        String baseUrl = baseUrl(company);
        if (baseUrl == null) {
            log.debug("No website for {}, skipping hiring intent", company.getName());
            return company;
        }
        for (String path : CAREERS_PATHS) {
            String url = baseUrl + path;
            HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT);
            if (!fetch.isSuccessful()) {
                log.debug("Careers page {} unavailable: {}", url, fetch.describeFailure());
                continue;
            }
            List<JobPostingSignal> postings = extractor.extract(fetch.body(), fetch.finalUrlOrRequested());
            if (postings.isEmpty()) {
                continue;
            }
            CompanyEnrichment enrichment = company.enrichmentOrCreate();
            enrichment.setHiringIntent(analyze(postings, LocalDate.now(ZoneOffset.UTC)));
            company.touch();
            log.debug("{} lists {} open positions at {}", company.getName(), postings.size(), url);
            return company;
        }
        return company;
    }

    HiringIntent analyze(List<JobPostingSignal> postings, LocalDate today) {
        HiringIntent intent = new HiringIntent();
        LocalDate recentCutoff = today.minusDays(RECENT_WINDOW_DAYS);
        LocalDate velocityCutoff = today.minusDays(VELOCITY_WINDOW_DAYS);
        int recent = 0;
        int withinVelocityWindow = 0;
        for (JobPostingSignal posting : postings) {
            LocalDate posted = posting.datePosted();
            if (posted != null && !posted.isBefore(recentCutoff)) {
                recent++;
            }
            if (posted != null && !posted.isBefore(velocityCutoff)) {
                withinVelocityWindow++;
            }
            intent.getDepartmentCounts().merge(department(posting.title()), 1, Integer::sum);
        }
        intent.setTotalOpenPositions(postings.size());
        intent.setRecentPostings(recent);
        intent.setHiringVelocity(withinVelocityWindow / 3.0);
        intent.setHiring(!postings.isEmpty());
        return intent;
    }

    static String department(String title) {
        if (title == null || title.isBlank()) {
            return "other";
        }
        String lower = title.toLowerCase(Locale.ROOT);
        if (containsAny(lower, ENGINEERING_KEYWORDS)) {
            return "engineering";
        }
        if (containsAny(lower, SALES_KEYWORDS)) {
            return "sales";
        }
        if (containsAny(lower, MARKETING_KEYWORDS)) {
            return "marketing";
        }
        return "other";
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private String baseUrl(Company company) {
        String source = company.getWebsite() != null ? company.getWebsite() : company.getDomain();
        return DomainNames.origin(source);
    }
}
