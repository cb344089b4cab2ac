package com.gigateer.ingestor.domain.model;

/**
 * A normalized gig together with the deduplicator's decision.
 *
 * @param gig                 document to write; for UPDATE and UNCHANGED it already
 *                            carries the stored firstSeen and provenance
 * @param action              what persistence should do with it
 * @param raw                 record the gig was normalized from, kept for error logging
 * @param crossSourceOf       source id of the stored gig this record collided with,
 *                            null unless two sources listed the same event
 */
public record ClassifiedGig(Gig gig, MergeAction action, RawRecord raw, String crossSourceOf) {

    public ClassifiedGig(Gig gig, MergeAction action, RawRecord raw) {
        this(gig, action, raw, null);
    }

    public String key() {
        return gig.getIdentityKey();
    }

    public boolean isCrossSource() {
        return crossSourceOf != null;
    }
}
