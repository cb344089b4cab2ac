package com.gigateer.ingestor.domain.model;

/**
 * A gig that passed normalization, paired with the record it came from.
 */
public record NormalizedGig(Gig gig, RawRecord raw) {
}
