package com.openlead.intel.pipeline.enrich;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlead.intel.pipeline.model.JobPostingSignal;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads schema.org {@code JobPosting} objects from the JSON-LD blocks of a careers page.
 * Postings nested in arrays or {@code @graph} containers are found as well.
 */
@Component
public class JobPostingExtractor {
    private static final Logger log = LoggerFactory.getLogger(JobPostingExtractor.class);
    private static final String JOB_POSTING_TYPE = "JobPosting";

    private final ObjectMapper objectMapper;

    public JobPostingExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JobPostingSignal> extract(String html, String pageUrl) {
        List<JobPostingSignal> postings = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return postings;
        }
        for (Element script : Jsoup.parse(html).select("script[type=application/ld+json]")) {
            JsonNode root = readBlock(script.data(), pageUrl);
            if (root != null) {
                collectPostings(root, postings);
            }
        }
        return postings;
    }

    private JsonNode readBlock(String payload, String pageUrl) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed JSON-LD block on {}: {}", pageUrl, e.getOriginalMessage());
            return null;
        }
    }

    private void collectPostings(JsonNode root, List<JobPostingSignal> out) {
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            JsonNode node = pending.removeFirst();
            if (node.isObject() && isJobPosting(node.path("@type"))) {
                out.add(new JobPostingSignal(title(node), postedOn(node.path("datePosted").asText(null))));
            }
            for (JsonNode child : node) {
                if (child.isContainerNode()) {
                    pending.addLast(child);
                }
            }
        }
    }

    private boolean isJobPosting(JsonNode type) {
        if (type.isArray()) {
            for (JsonNode value : type) {
                if (JOB_POSTING_TYPE.equalsIgnoreCase(value.asText())) {
                    return true;
                }
            }
            return false;
        }
        return type.isTextual() && JOB_POSTING_TYPE.equalsIgnoreCase(type.asText());
    }

    private String title(JsonNode posting) {
        for (String field : List.of("title", "name")) {
            String value = posting.path(field).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private LocalDate postedOn(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String day = raw.trim();
        if (day.length() > 10) {
            day = day.substring(0, 10);
        }
        try {
            return LocalDate.parse(day);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable datePosted '{}'", raw);
            return null;
        }
    }
}
