package com.openlead.intel.pipeline.score;

import com.openlead.intel.pipeline.model.Company;
import com.openlead.intel.pipeline.model.CompanyEnrichment;
import com.openlead.intel.pipeline.model.CompanySize;
import com.openlead.intel.pipeline.model.DataSource;
import com.openlead.intel.pipeline.model.FundingInfo;
import com.openlead.intel.pipeline.model.FundingStage;
import com.openlead.intel.pipeline.model.HiringIntent;
import com.openlead.intel.pipeline.model.LeadScore;
import com.openlead.intel.pipeline.model.Priority;
import com.openlead.intel.pipeline.model.SocialProfiles;
import com.openlead.intel.pipeline.model.TechStack;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LeadScorerTest {
    private final LeadScorer scorer = new LeadScorer();

    @Test
    void scoresWellEnrichedStartup() {
        LeadScore score = scorer.score(startup());

        assertThat(score.getIntent()).isEqualTo(80.0);
        assertThat(score.getFit()).isEqualTo(90.0);
        assertThat(score.getTech()).isEqualTo(90.0);
        assertThat(score.getEngagement()).isEqualTo(50.0);
        assertThat(score.getTotal()).isCloseTo(80.5, within(0.01));
        assertThat(score.getPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void bareRecordOnlyEarnsNeutralFit() {
        LeadScore score = scorer.score(new Company("Initech", DataSource.MANUAL));

        assertThat(score.getIntent()).isZero();
        assertThat(score.getFit()).isEqualTo(50.0);
        assertThat(score.getTech()).isZero();
        assertThat(score.getEngagement()).isZero();
        assertThat(score.getTotal()).isCloseTo(15.0, within(0.01));
        assertThat(score.getPriority()).isEqualTo(Priority.LOW);
    }

    @Test
    void totalIsWeightedSumOfComponents() {
        ScoringWeights weights = scorer.getWeights();
        for (Company company : List.of(startup(), new Company("Hooli", DataSource.MANUAL), saturated())) {
            LeadScore score = scorer.score(company);
            double expected = score.getIntent() * weights.intent()
                + score.getFit() * weights.fit()
                + score.getTech() * weights.tech()
                + score.getEngagement() * weights.engagement();
            assertThat(score.getTotal()).isCloseTo(expected, within(0.01));
        }
    }

    @Test
    void componentsAreCappedAtOneHundred() {
        LeadScore score = scorer.score(saturated());

        assertThat(score.getIntent()).isEqualTo(100.0);
        assertThat(score.getEngagement()).isEqualTo(100.0);
        assertThat(score.getTotal()).isLessThanOrEqualTo(100.0);
    }

    @Test
    void priorityBoundaries() {
        assertThat(Priority.fromTotal(70.0)).isEqualTo(Priority.HIGH);
        assertThat(Priority.fromTotal(69.99)).isEqualTo(Priority.MEDIUM);
        assertThat(Priority.fromTotal(40.0)).isEqualTo(Priority.MEDIUM);
        assertThat(Priority.fromTotal(39.99)).isEqualTo(Priority.LOW);
    }

    @Test
    void unlistedFundingStageHalvesSizeScore() {
        Company bootstrapped = new Company("Wonka", DataSource.MANUAL);
        bootstrapped.enrichmentOrCreate().setCompanySize(CompanySize.MEDIUM);
        FundingInfo bootstrappedFunding = new FundingInfo();
        bootstrappedFunding.setStage(FundingStage.BOOTSTRAPPED);
        bootstrapped.getEnrichment().setFundingInfo(bootstrappedFunding);

        Company seriesB = new Company("Tyrell", DataSource.MANUAL);
        seriesB.enrichmentOrCreate().setCompanySize(CompanySize.MEDIUM);
        FundingInfo seriesBFunding = new FundingInfo();
        seriesBFunding.setStage(FundingStage.SERIES_B);
        seriesB.getEnrichment().setFundingInfo(seriesBFunding);

        assertThat(scorer.fitScore(bootstrapped)).isEqualTo(45.0);
        assertThat(scorer.fitScore(seriesB)).isEqualTo(90.0);
    }

    @Test
    void smallTeamsGetSmallerEmployeeBonus() {
        Company company = new Company("Cyberdyne", DataSource.MANUAL);
        company.enrichmentOrCreate().setCompanySize(CompanySize.STARTUP);
        company.getEnrichment().setEmployeeCount(8);

        assertThat(scorer.fitScore(company)).isEqualTo(75.0);
    }

    @Test
    void frameworkMatchIsSubstringBased() {
        Company company = new Company("Soylent", DataSource.MANUAL);
        TechStack stack = new TechStack();
        stack.getFrameworks().add("Vue.js");
        company.enrichmentOrCreate().setTechStack(stack);

        assertThat(scorer.techScore(company)).isEqualTo(60.0);
    }

    @Test
    void unnormalizedWeightsAreRescaled() {
        LeadScorer custom = new LeadScorer(new ScoringWeights(0.5, 0.5, 0.5, 0.5));

        assertThat(custom.getWeights().intent()).isCloseTo(0.25, within(1e-9));
        assertThat(custom.getWeights().sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void scoreAllOrdersByTotalDescending() {
        Company bare = new Company("Aperture", DataSource.MANUAL);
        Company rich = startup();
        Company full = saturated();

        List<Company> ranked = scorer.scoreAll(List.of(bare, rich, full));

        assertThat(ranked).containsExactly(full, rich, bare);
        assertThat(ranked).allSatisfy(company -> assertThat(company.getScore()).isNotNull());
    }

    private Company startup() {
        Company company = new Company("Test Startup", DataSource.MANUAL);
        company.setWebsite("https://teststartup.com");
        company.setDescription("An AI-powered analytics platform");
        CompanyEnrichment enrichment = company.enrichmentOrCreate();
        enrichment.setCompanySize(CompanySize.SMALL);
        enrichment.setEmployeeCount(45);
        HiringIntent hiring = new HiringIntent();
        hiring.setTotalOpenPositions(8);
        hiring.setRecentPostings(5);
        hiring.setHiring(true);
        enrichment.setHiringIntent(hiring);
        TechStack stack = new TechStack();
        stack.getFrameworks().add("React");
        stack.getFrameworks().add("Django");
        stack.getDatabases().add("PostgreSQL");
        stack.getCloudProviders().add("AWS");
        enrichment.setTechStack(stack);
        return company;
    }

    private Company saturated() {
        Company company = new Company("Stark Industries", DataSource.MANUAL);
        company.setWebsite("https://stark.com");
        company.setDescription("Defense and energy");
        CompanyEnrichment enrichment = company.enrichmentOrCreate();
        enrichment.setCompanySize(CompanySize.MEDIUM);
        enrichment.setEmployeeCount(150);
        HiringIntent hiring = new HiringIntent();
        hiring.setTotalOpenPositions(100);
        hiring.setRecentPostings(100);
        hiring.setHiringVelocity(100);
        hiring.setHiring(true);
        enrichment.setHiringIntent(hiring);
        TechStack stack = new TechStack();
        stack.getFrameworks().add("Next.js");
        stack.getDatabases().add("Redis");
        stack.getCloudProviders().add("GCP");
        stack.getAnalytics().add("Segment");
        enrichment.setTechStack(stack);
        SocialProfiles profiles = new SocialProfiles();
        profiles.setLinkedin("https://linkedin.com/company/stark");
        profiles.setTwitter("https://twitter.com/stark");
        profiles.setGithub("https://github.com/stark");
        profiles.setCrunchbase("https://crunchbase.com/organization/stark");
        enrichment.setSocialProfiles(profiles);
        return company;
    }
}
