package com.openlead.intel.pipeline.adapter;

import com.openlead.intel.pipeline.http.PoliteHttpClient;
import com.openlead.intel.pipeline.model.BatchResult;
import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.model.HttpFetchResult;
import com.openlead.intel.pipeline.util.CompanyNames;
import com.openlead.intel.pipeline.util.DomainNames;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls company-like entries out of an arbitrary listing page (directories, "top 10" lists,
 * link tables). Three heuristics are tried in order and the first one that yields anything wins.
 */
@Component
public class GenericListingAdapter implements SourceAdapter<GenericListingConfig, ListingCandidate> {
    public static final String NAME = "generic-listing";
    public static final String TAG = "generic-scrape";

    private static final Logger log = LoggerFactory.getLogger(GenericListingAdapter.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final List<String> ITEM_CLASS_HINTS = List.of("item", "card", "row", "listing");
    private static final int MAX_ITEM_ELEMENTS = 20;
    private static final int MAX_TABLE_ROWS = 50;

    private final PoliteHttpClient httpClient;

    public GenericListingAdapter(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult scrape(GenericListingConfig config) {
        Instant startedAt = Instant.now();
        BatchResult result = new BatchResult(DataSource.MANUAL);
        try {
            log.info("Generic listing scrape starting for {}", config.url());
            HttpFetchResult fetch = httpClient.get(config.url(), HTML_ACCEPT);
            if (!fetch.isSuccessful() || fetch.body() == null) {
                result.addError("Could not load " + config.url() + ": " + fetch.describeFailure());
                return result;
            }
            Document document = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
            List<ListingCandidate> candidates = extractCandidates(document, config.url());
            log.info("Found {} listing candidates on {}", candidates.size(), config.url());

            Set<String> seenNames = new HashSet<>();
            for (ListingCandidate candidate : candidates) {
                if (result.getRecords().size() >= config.maxRecords()) {
                    break;
                }
                if (!seenNames.add(candidate.name())) {
                    continue;
                }
                Company company = parseRecord(candidate);
                if (company != null) {
                    result.addRecord(company);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Generic listing scrape failed for {}", config.url(), e);
            result.addError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            result.setElapsed(Duration.between(startedAt, Instant.now()));
        }
        log.info("Generic listing scrape finished for {}: {} records", config.url(), result.getRecords().size());
        return result;
    }

    @Override
    public Company parseRecord(ListingCandidate raw) {
        if (raw == null || raw.name() == null || raw.name().isBlank()) {
            return null;
        }
        Company company = new Company(raw.name(), DataSource.MANUAL);
        company.setWebsite(raw.url());
        company.setDomain(DomainNames.extract(raw.url()));
        company.setDescription(raw.description());
        company.setSourceUrl(raw.pageUrl());
        company.enrichmentOrCreate().getTags().add(TAG);
        return company;
    }

    List<ListingCandidate> extractCandidates(Document document, String pageUrl) {
        List<ListingCandidate> candidates = fromHeadings(document, pageUrl);
        if (candidates.isEmpty()) {
            candidates = fromItemElements(document, pageUrl);
        }
        if (candidates.isEmpty()) {
            log.debug("Heading and item heuristics found nothing on {}, trying table rows", pageUrl);
            candidates = fromTableRows(document, pageUrl);
        }
        return candidates;
    }

    private List<ListingCandidate> fromHeadings(Document document, String pageUrl) {
        List<ListingCandidate> out = new ArrayList<>();
        Elements allElements = document.getAllElements();
        for (String tag : List.of("h2", "h3", "h4")) {
            for (Element heading : document.getElementsByTag(tag)) {
                Element link = heading.selectFirst("a");
                if (link == null || !link.hasAttr("href")) {
                    continue;
                }
                String name = CompanyNames.cleanText(heading.text());
                if (name.length() > 2 && name.length() < 50) {
                    Element description = nextParagraph(allElements, heading);
                    out.add(new ListingCandidate(name, resolveHref(link), textOf(description), pageUrl));
                }
            }
        }
        return out;
    }

    private List<ListingCandidate> fromItemElements(Document document, String pageUrl) {
        List<ListingCandidate> out = new ArrayList<>();
        int inspected = 0;
        for (Element element : document.select("div[class], li[class]")) {
            if (!hasItemClass(element)) {
                continue;
            }
            if (inspected++ >= MAX_ITEM_ELEMENTS) {
                break;
            }
            Element link = element.selectFirst("a");
            if (link == null || !link.hasAttr("href")) {
                continue;
            }
            String text = CompanyNames.cleanText(link.text());
            if (!text.isEmpty()) {
                out.add(new ListingCandidate(text, resolveHref(link), textOf(element.selectFirst("p")), pageUrl));
            }
        }
        return out;
    }

    private List<ListingCandidate> fromTableRows(Document document, String pageUrl) {
        List<ListingCandidate> out = new ArrayList<>();
        Elements rows = document.getElementsByTag("tr");
        for (int i = 0; i < Math.min(rows.size(), MAX_TABLE_ROWS); i++) {
            Element link = rows.get(i).selectFirst("a");
            if (link == null || !link.hasAttr("href")) {
                continue;
            }
            String text = CompanyNames.cleanText(link.text());
            if (text.length() > 5) {
                out.add(new ListingCandidate(text, resolveHref(link), null, pageUrl));
            }
        }
        return out;
    }

    private boolean hasItemClass(Element element) {
        String className = element.className();
        for (String hint : ITEM_CLASS_HINTS) {
            if (className.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private Element nextParagraph(Elements allElements, Element start) {
        boolean passed = false;
        for (Element element : allElements) {
            if (passed && "p".equals(element.normalName())) {
                return element;
            }
            if (element == start) {
                passed = true;
            }
        }
        return null;
    }

    private String resolveHref(Element link) {
        String absolute = link.absUrl("href");
        return absolute.isEmpty() ? link.attr("href") : absolute;
    }

    private String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String text = CompanyNames.cleanText(element.text());
        return text.isEmpty() ? null : text;
    }
}
