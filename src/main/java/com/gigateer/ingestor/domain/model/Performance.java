package com.gigateer.ingestor.domain.model;

import java.time.Instant;

/**
 * One occurrence of a residency or series listed as a single gig.
 */
public record Performance(String parentKey, Instant occurrence) {
}
