package com.gigateer.ingestor.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gigateer.ingestor.application.dedup.GigDeduplicator;
import com.gigateer.ingestor.application.normalize.ContentHasher;
import com.gigateer.ingestor.application.normalize.GigNormalizer;
import com.gigateer.ingestor.application.normalize.RawDateParser;
import com.gigateer.ingestor.application.persistence.PersistenceCoordinator;
import com.gigateer.ingestor.application.run.RunTracker;
import com.gigateer.ingestor.application.run.SourceRunLocks;
import com.gigateer.ingestor.domain.ports.ErrorLogRepository;
import com.gigateer.ingestor.domain.ports.GigRepository;
import com.gigateer.ingestor.domain.ports.IngestionEventSink;
import com.gigateer.ingestor.domain.ports.ScraperRunRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pipeline components that carry no Spring annotations.
 */
@Configuration
@EnableConfigurationProperties(IngestorProperties.class)
public class IngestionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ContentHasher contentHasher(ObjectMapper objectMapper) {
        return new ContentHasher(objectMapper);
    }

    @Bean
    public GigNormalizer gigNormalizer(Clock clock, ContentHasher contentHasher) {
        return new GigNormalizer(new RawDateParser(clock), contentHasher);
    }

    @Bean
    public GigDeduplicator gigDeduplicator(ContentHasher contentHasher) {
        return new GigDeduplicator(contentHasher);
    }

    @Bean
    public PersistenceCoordinator persistenceCoordinator(GigRepository gigRepository) {
        return new PersistenceCoordinator(gigRepository);
    }

    @Bean
    public RunTracker runTracker(
            ScraperRunRepository runRepository,
            ErrorLogRepository errorLogRepository,
            IngestionEventSink eventSink,
            ObjectMapper objectMapper,
            Clock clock) {
        return new RunTracker(runRepository, errorLogRepository, eventSink, objectMapper, clock);
    }

    @Bean
    public SourceRunLocks sourceRunLocks() {
        return new SourceRunLocks();
    }
}
