package com.gigateer.ingestor.domain.model;

import java.util.List;

/**
 * Outcome of persisting one classified batch.
 *
 * @param created   gigs inserted
 * @param updated   gigs replaced
 * @param unchanged gigs only touched
 * @param failed    records whose write was rejected, one entry each
 */
public record BulkOperationResult(int created, int updated, int unchanged, List<FailedWrite> failed) {

    public BulkOperationResult {
        failed = List.copyOf(failed);
    }

    public static BulkOperationResult empty() {
        return new BulkOperationResult(0, 0, 0, List.of());
    }

    /**
     * A single rejected write.
     */
    public record FailedWrite(String key, RawRecord raw, String error) {
    }
}
