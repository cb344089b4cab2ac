package com.gigateer.ingestor.domain.model;

/**
 * Decision taken by the deduplicator for one normalized gig.
 */
public enum MergeAction {
    CREATE,
    UPDATE,
    UNCHANGED,
    /** Same identity key already seen earlier in the same batch. */
    SKIP
}
