package com.openlead.intel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openlead.intel.pipeline.dedup.CompanyDeduplicator;
import com.openlead.intel.pipeline.score.LeadScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean(name = "adapterExecutor", destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerPoolSize());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(PipelineProperties properties) {
        int size = Math.max(4, properties.getWorkerPoolSize() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "pipelineRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pipelineRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public CompanyDeduplicator companyDeduplicator(PipelineProperties properties) {
        return new CompanyDeduplicator(properties.getDeduplication().getNameSimilarityThreshold());
    }

    @Bean
    public LeadScorer leadScorer(PipelineProperties properties) {
        return new LeadScorer(properties.getScoring().getWeights().toScoringWeights());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
