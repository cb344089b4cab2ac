package com.gigateer.ingestor.domain.model;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Effective per-source settings, defaults already applied.
 *
 * @param sourceId         source identifier, e.g. "bristol-the-croft"
 * @param listingUrl       page the adapter starts from
 * @param timezoneDefault  zone applied to local date-times without an offset
 * @param defaultStartTime time used when a listing gives only a date, may be null
 * @param venueAliasTable  raw venue name to canonical venue name
 * @param dateFormats      extra {@link java.time.format.DateTimeFormatter} patterns, tried in order
 * @param batchSizeLimit   maximum writes per bulk request
 * @param runTimeoutMs     wall-clock budget for one run
 * @param staleAfterRuns   consecutive missed runs before a gig is flagged stale
 */
public record SourceConfig(
    String sourceId,
    String listingUrl,
    ZoneId timezoneDefault,
    LocalTime defaultStartTime,
    Map<String, String> venueAliasTable,
    List<String> dateFormats,
    int batchSizeLimit,
    long runTimeoutMs,
    int staleAfterRuns
) {

    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final long DEFAULT_RUN_TIMEOUT_MS = 300_000L;
    public static final int DEFAULT_STALE_AFTER_RUNS = 3;

    public SourceConfig {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required");
        }
        if (timezoneDefault == null) {
            timezoneDefault = ZoneId.of("UTC");
        }
        venueAliasTable = venueAliasTable == null ? Map.of() : Map.copyOf(venueAliasTable);
        dateFormats = dateFormats == null ? List.of() : List.copyOf(dateFormats);
        if (batchSizeLimit <= 0) {
            throw new IllegalArgumentException("batchSizeLimit must be positive for " + sourceId);
        }
        if (runTimeoutMs <= 0) {
            throw new IllegalArgumentException("runTimeoutMs must be positive for " + sourceId);
        }
        if (staleAfterRuns <= 0) {
            throw new IllegalArgumentException("staleAfterRuns must be positive for " + sourceId);
        }
    }

    public static SourceConfig withDefaults(String sourceId, ZoneId timezone) {
        return new SourceConfig(sourceId, null, timezone, null, Map.of(), List.of(),
            DEFAULT_BATCH_SIZE, DEFAULT_RUN_TIMEOUT_MS, DEFAULT_STALE_AFTER_RUNS);
    }
}
