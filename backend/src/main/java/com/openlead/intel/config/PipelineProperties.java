package com.openlead.intel.config;

import com.openlead.intel.pipeline.http.RetryPolicy;
import com.openlead.intel.pipeline.score.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private int workerPoolSize = 3;
    private double minScoreThreshold = 0.0;
    private Deduplication deduplication = new Deduplication();
    private Enrichment enrichment = new Enrichment();
    private Scoring scoring = new Scoring();
    private Run run = new Run();
    private Http http = new Http();
    private Export export = new Export();
    private Cli cli = new Cli();

    public int getWorkerPoolSize() {
        return Math.max(1, workerPoolSize);
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = Math.max(1, workerPoolSize);
    }

    public double getMinScoreThreshold() {
        return minScoreThreshold;
    }

    public void setMinScoreThreshold(double minScoreThreshold) {
        this.minScoreThreshold = minScoreThreshold;
    }

    public Deduplication getDeduplication() {
        return deduplication;
    }

    public void setDeduplication(Deduplication deduplication) {
        this.deduplication = deduplication;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Deduplication {
        private boolean enabled = true;
        private double nameSimilarityThreshold = 0.85;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getNameSimilarityThreshold() {
            return nameSimilarityThreshold;
        }

        public void setNameSimilarityThreshold(double nameSimilarityThreshold) {
            this.nameSimilarityThreshold = nameSimilarityThreshold;
        }
    }

    public static class Enrichment {
        private boolean enabled = true;
        private List<String> enrichers = new ArrayList<>(List.of("hiring-intent", "company-size", "geographic"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getEnrichers() {
            return enrichers;
        }

        public void setEnrichers(List<String> enrichers) {
            this.enrichers = enrichers == null ? new ArrayList<>() : enrichers;
        }
    }

    public static class Scoring {
        private boolean enabled = true;
        private Weights weights = new Weights();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Weights getWeights() {
            return weights;
        }

        public void setWeights(Weights weights) {
            this.weights = weights;
        }
    }

    public static class Weights {
        private double intent = ScoringWeights.DEFAULT.intent();
        private double fit = ScoringWeights.DEFAULT.fit();
        private double tech = ScoringWeights.DEFAULT.tech();
        private double engagement = ScoringWeights.DEFAULT.engagement();

        public double getIntent() {
            return intent;
        }

        public void setIntent(double intent) {
            this.intent = intent;
        }

        public double getFit() {
            return fit;
        }

        public void setFit(double fit) {
            this.fit = fit;
        }

        public double getTech() {
            return tech;
        }

        public void setTech(double tech) {
            this.tech = tech;
        }

        public double getEngagement() {
            return engagement;
        }

        public void setEngagement(double engagement) {
            this.engagement = engagement;
        }

        public ScoringWeights toScoringWeights() {
            return new ScoringWeights(intent, fit, tech, engagement);
        }
    }

    public static class Run {
        private int maxDurationSeconds = 0;

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }
    }

    public static class Http {
        private static final String DEFAULT_USER_AGENT = "lead-intel/0.1 (+contact)";

        private String userAgent;
        private int perHostDelayMs = 1000;
        private int requestTimeoutSeconds = 30;
        private int maxAttempts = 4;
        private int retryBaseDelayMs = 1000;
        private double retryMultiplier = 2.0;
        private int retryMaxDelayMs = 8000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public double getRetryMultiplier() {
            return Math.max(1.0, retryMultiplier);
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = Math.max(1.0, retryMultiplier);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(
                getMaxAttempts(),
                Duration.ofMillis(getRetryBaseDelayMs()),
                getRetryMultiplier(),
                Duration.ofMillis(getRetryMaxDelayMs())
            );
        }

        public static String normalizeUserAgent(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return DEFAULT_USER_AGENT;
            }
            return candidate.trim();
        }
    }

    public static class Export {
        private String outputDir = "output";

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }

    public static class Cli {
        private boolean run;
        private String listingUrls = "";
        private String csvFiles = "";
        private int maxRecordsPerSource = 20;
        private String outputFormat = "csv";
        private String outputFile = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getListingUrls() {
            return listingUrls;
        }

        public void setListingUrls(String listingUrls) {
            this.listingUrls = listingUrls;
        }

        public String getCsvFiles() {
            return csvFiles;
        }

        public void setCsvFiles(String csvFiles) {
            this.csvFiles = csvFiles;
        }

        public int getMaxRecordsPerSource() {
            return Math.max(1, maxRecordsPerSource);
        }

        public void setMaxRecordsPerSource(int maxRecordsPerSource) {
            this.maxRecordsPerSource = Math.max(1, maxRecordsPerSource);
        }

        public String getOutputFormat() {
            return outputFormat;
        }

        public void setOutputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
        }

        public String getOutputFile() {
            return outputFile;
        }

        public void setOutputFile(String outputFile) {
            this.outputFile = outputFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
