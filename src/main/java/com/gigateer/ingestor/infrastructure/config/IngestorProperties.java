package com.gigateer.ingestor.infrastructure.config;

import com.gigateer.ingestor.application.normalize.RawDateParser;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.ports.SourceConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ingestion settings bound from the {@code ingestor.*} properties.
 *
 * <p>Per-source values fall back to {@link Defaults}. Every source is
 * validated once binding completes, so a bad zone id or
 * date pattern stops the application instead of failing a run later.
 */
@ConfigurationProperties(prefix = "ingestor")
public class IngestorProperties implements SourceConfigProvider, InitializingBean {

    private static final Logger logger = LoggerFactory.getLogger(IngestorProperties.class);

    private int parallelism = 4;

    private Defaults defaults = new Defaults();

    private Map<String, Source> sources = new LinkedHashMap<>();

    @Override
    public Optional<SourceConfig> find(String sourceId) {
        Source source = sources.get(sourceId);
        if (source == null || !source.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(toSourceConfig(sourceId, source));
    }

    @Override
    public Set<String> sourceIds() {
        Set<String> enabled = new LinkedHashSet<>();
        sources.forEach((sourceId, source) -> {
            if (source.isEnabled()) {
                enabled.add(sourceId);
            }
        });
        return enabled;
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Builds every enabled source once.
     *
     * @throws IllegalStateException naming the first invalid source
     */
    public void validate() {
        for (String sourceId : sourceIds()) {
            SourceConfig config = find(sourceId).orElseThrow();
            for (String pattern : config.dateFormats()) {
                try {
                    RawDateParser.compilePattern(pattern);
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException(
                        String.format("Invalid date format \"%s\" for source %s: %s", pattern, sourceId, e.getMessage()), e);
                }
            }
        }
        logger.info("Loaded configuration for {} sources: {}", sourceIds().size(), sourceIds());
    }

    SourceConfig toSourceConfig(String sourceId, Source source) {
        try {
            String zone = source.getTimezone() != null ? source.getTimezone() : defaults.getTimezone();
            String startTime = source.getDefaultStartTime() != null
                ? source.getDefaultStartTime()
                : defaults.getDefaultStartTime();
            return new SourceConfig(
                sourceId,
                source.getListingUrl(),
                ZoneId.of(zone),
                startTime != null ? LocalTime.parse(startTime) : null,
                source.getVenueAliases(),
                source.getDateFormats(),
                source.getBatchSizeLimit() != null ? source.getBatchSizeLimit() : defaults.getBatchSizeLimit(),
                source.getRunTimeoutMs() != null ? source.getRunTimeoutMs() : defaults.getRunTimeoutMs(),
                source.getStaleAfterRuns() != null ? source.getStaleAfterRuns() : defaults.getStaleAfterRuns());
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configuration for source " + sourceId + ": " + e.getMessage(), e);
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources;
    }

    /**
     * Values used by sources that do not set their own.
     */
    public static class Defaults {

        private String timezone = "Europe/London";

        /** ISO local time such as "20:00"; unset means midnight for date-only listings. */
        private String defaultStartTime;

        private int batchSizeLimit = SourceConfig.DEFAULT_BATCH_SIZE;

        private long runTimeoutMs = SourceConfig.DEFAULT_RUN_TIMEOUT_MS;

        private int staleAfterRuns = SourceConfig.DEFAULT_STALE_AFTER_RUNS;

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getDefaultStartTime() {
            return defaultStartTime;
        }

        public void setDefaultStartTime(String defaultStartTime) {
            this.defaultStartTime = defaultStartTime;
        }

        public int getBatchSizeLimit() {
            return batchSizeLimit;
        }

        public void setBatchSizeLimit(int batchSizeLimit) {
            this.batchSizeLimit = batchSizeLimit;
        }

        public long getRunTimeoutMs() {
            return runTimeoutMs;
        }

        public void setRunTimeoutMs(long runTimeoutMs) {
            this.runTimeoutMs = runTimeoutMs;
        }

        public int getStaleAfterRuns() {
            return staleAfterRuns;
        }

        public void setStaleAfterRuns(int staleAfterRuns) {
            this.staleAfterRuns = staleAfterRuns;
        }
    }

    public static class Source {

        private boolean enabled = true;

        private String listingUrl;

        private String timezone;

        private String defaultStartTime;

        private Map<String, String> venueAliases = new LinkedHashMap<>();

        private List<String> dateFormats = new ArrayList<>();

        private Integer batchSizeLimit;

        private Long runTimeoutMs;

        private Integer staleAfterRuns;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getListingUrl() {
            return listingUrl;
        }

        public void setListingUrl(String listingUrl) {
            this.listingUrl = listingUrl;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getDefaultStartTime() {
            return defaultStartTime;
        }

        public void setDefaultStartTime(String defaultStartTime) {
            this.defaultStartTime = defaultStartTime;
        }

        public Map<String, String> getVenueAliases() {
            return venueAliases;
        }

        public void setVenueAliases(Map<String, String> venueAliases) {
            this.venueAliases = venueAliases;
        }

        public List<String> getDateFormats() {
            return dateFormats;
        }

        public void setDateFormats(List<String> dateFormats) {
            this.dateFormats = dateFormats;
        }

        public Integer getBatchSizeLimit() {
            return batchSizeLimit;
        }

        public void setBatchSizeLimit(Integer batchSizeLimit) {
            this.batchSizeLimit = batchSizeLimit;
        }

        public Long getRunTimeoutMs() {
            return runTimeoutMs;
        }

        public void setRunTimeoutMs(Long runTimeoutMs) {
            this.runTimeoutMs = runTimeoutMs;
        }

        public Integer getStaleAfterRuns() {
            return staleAfterRuns;
        }

        public void setStaleAfterRuns(Integer staleAfterRuns) {
            this.staleAfterRuns = staleAfterRuns;
        }
    }
}
