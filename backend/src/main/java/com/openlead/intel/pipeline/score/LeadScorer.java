package com.openlead.intel.pipeline.score;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.CompanySize;
import com.openlead.intel.pipeline.model.FundingStage;
import com.openlead.intel.pipeline.model.HiringIntent;
import com.openlead.intel.pipeline.model.LeadScore;
import com.openlead.intel.pipeline.model.SocialProfiles;
import com.openlead.intel.pipeline.model.TechStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores companies on hiring intent, company fit, tech stack and online engagement, each in
 * [0, 100], and combines them into a weighted total.
 */
public class LeadScorer {
    private static final Logger log = LoggerFactory.getLogger(LeadScorer.class);

    private static final Map<CompanySize, Double> SIZE_SCORES = new EnumMap<>(Map.of(
        CompanySize.STARTUP, 70.0,
        CompanySize.SMALL, 80.0,
        CompanySize.MEDIUM, 90.0,
        CompanySize.LARGE, 70.0,
        CompanySize.ENTERPRISE, 50.0,
        CompanySize.UNKNOWN, 40.0
    ));
    // Stages missing here score 0 and pull the averaged fit score down.
    private static final Map<FundingStage, Double> FUNDING_SCORES = new EnumMap<>(Map.of(
        FundingStage.SEED, 60.0,
        FundingStage.SERIES_A, 80.0,
        FundingStage.SERIES_B, 90.0,
        FundingStage.SERIES_C, 85.0,
        FundingStage.SERIES_D_PLUS, 75.0
    ));
    private static final List<String> MODERN_FRAMEWORKS = List.of("React", "Vue", "Angular", "Svelte", "Next.js");
    private static final List<String> MODERN_DATABASES = List.of("MongoDB", "PostgreSQL", "Redis");

    private final ScoringWeights weights;

    public LeadScorer() {
        this(ScoringWeights.DEFAULT);
    }

    public LeadScorer(ScoringWeights weights) {
        ScoringWeights requested = weights == null ? ScoringWeights.DEFAULT : weights;
        if (!requested.isNormalized()) {
            log.warn("Scoring weights sum to {}, normalizing to 1.0", requested.sum());
        }
        this.weights = requested.normalized();
        log.info("Initialized LeadScorer with weights {}", this.weights);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public LeadScore score(Company company) {
        LeadScore score = LeadScore.compute(
            intentScore(company),
            fitScore(company),
            techScore(company),
            engagementScore(company),
            weights
        );
        log.debug("Scored {}: {}", company.getName(), score);
        return score;
    }

    /**
     * Attaches a score to every company and returns them ordered by total, highest first.
     */
    public List<Company> scoreAll(Collection<Company> companies) {
        log.info("Scoring {} companies", companies.size());
        List<Company> scored = new ArrayList<>(companies);
        for (Company company : scored) {
            company.setScore(score(company));
            company.touch();
        }
        scored.sort(Comparator.comparingDouble((Company c) -> c.getScore().getTotal()).reversed());
        return scored;
    }

    public double intentScore(Company company) {
        CompanyEnrichment enrichment = company.getEnrichment();
        if (enrichment == null || enrichment.getHiringIntent() == null) {
            return 0.0;
        }
        HiringIntent hiring = enrichment.getHiringIntent();
        double score = 0.0;
        if (hiring.isHiring()) {
            score += 30.0;
        }
        if (hiring.getTotalOpenPositions() > 0) {
            score += Math.min(hiring.getTotalOpenPositions() * 5.0, 30.0);
        }
        if (hiring.getRecentPostings() > 0) {
            score += Math.min(hiring.getRecentPostings() * 10.0, 20.0);
        }
        if (hiring.getHiringVelocity() > 0) {
            score += Math.min(hiring.getHiringVelocity() * 5.0, 20.0);
        }
        return Math.min(score, 100.0);
    }

    public double fitScore(Company company) {
        CompanyEnrichment enrichment = company.getEnrichment();
        if (enrichment == null) {
            return 50.0;
        }
        double score = SIZE_SCORES.getOrDefault(enrichment.getCompanySize(), 50.0);
        if (enrichment.getFundingInfo() != null) {
            double fundingScore = FUNDING_SCORES.getOrDefault(enrichment.getFundingInfo().getStage(), 0.0);
            score = (score + fundingScore) / 2.0;
        }
        Integer employees = enrichment.getEmployeeCount();
        if (employees != null && employees > 0) {
            if (employees >= 20 && employees <= 500) {
                score += 10.0;
            } else if (employees < 20) {
                score += 5.0;
            }
        }
        return Math.min(score, 100.0);
    }

    public double techScore(Company company) {
        CompanyEnrichment enrichment = company.getEnrichment();
        if (enrichment == null || enrichment.getTechStack() == null) {
            return 0.0;
        }
        TechStack stack = enrichment.getTechStack();
        double score = 0.0;
        if (!stack.allTechnologies().isEmpty()) {
            score = 40.0;
        }
        if (containsAny(stack.getFrameworks(), MODERN_FRAMEWORKS)) {
            score += 20.0;
        }
        if (!stack.getCloudProviders().isEmpty()) {
            score += 15.0;
        }
        if (containsAny(stack.getDatabases(), MODERN_DATABASES)) {
            score += 15.0;
        }
        if (!stack.getAnalytics().isEmpty()) {
            score += 10.0;
        }
        return Math.min(score, 100.0);
    }

    public double engagementScore(Company company) {
        double score = 0.0;
        if (company.hasWebPresence()) {
            score += 30.0;
        }
        if (hasText(company.getDescription())) {
            score += 20.0;
        }
        CompanyEnrichment enrichment = company.getEnrichment();
        if (enrichment == null || enrichment.getSocialProfiles() == null) {
            return score;
        }
        SocialProfiles profiles = enrichment.getSocialProfiles();
        if (hasText(profiles.getLinkedin())) {
            score += 15.0;
        }
        if (hasText(profiles.getTwitter())) {
            score += 10.0;
        }
        if (hasText(profiles.getGithub())) {
            score += 15.0;
        }
        if (hasText(profiles.getCrunchbase())) {
            score += 10.0;
        }
        return Math.min(score, 100.0);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean containsAny(Collection<String> values, List<String> keywords) {
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String keyword : keywords) {
                if (value.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
