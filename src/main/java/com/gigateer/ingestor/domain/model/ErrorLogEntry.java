package com.gigateer.ingestor.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable record of one failure inside a run. Append-only.
 *
 * @param runId       run the failure happened in
 * @param sourceId    source of the run
 * @param stage       pipeline stage that raised it
 * @param errorKind   classification, e.g. {@code INVALID_DATE} or {@code FETCH}
 * @param message     human readable error
 * @param identityKey key of the affected gig when it was already known
 * @param rawPayload  snapshot of the raw record for postmortem, empty for run-level failures
 * @param timestamp   when the failure was recorded
 */
public record ErrorLogEntry(
    String runId,
    String sourceId,
    ErrorStage stage,
    String errorKind,
    String message,
    String identityKey,
    Map<String, Object> rawPayload,
    Instant timestamp
) {

    public ErrorLogEntry {
        rawPayload = rawPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
    }
}
