package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.model.Gig;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Port for the gig document store. Implementations must keep at most one
 * document per identity key.
 *
 * <p>All methods may throw
 * {@link com.gigateer.ingestor.domain.exception.StoreUnavailableException}.
 */
public interface GigRepository {

    /**
     * Finds stored gigs by identity key.
     *
     * @return key to stored gig, absent keys omitted
     */
    Map<String, Gig> findByKeys(Collection<String> keys);

    /**
     * Finds stored gigs by source-independent fingerprint.
     *
     * @return fingerprint to stored gig, absent fingerprints omitted
     */
    Map<String, Gig> findByFingerprints(Collection<String> fingerprints);

    /**
     * Applies one bulk request. A rejected operation does not prevent the
     * others from being committed.
     *
     * @return one outcome per operation, in the same order
     */
    List<WriteOutcome> bulkUpsert(List<GigWrite> operations);

    /**
     * Bumps the missed-run counter of every non-seen gig owned by the source
     * and flags those that reached the threshold as stale.
     *
     * @return number of gigs newly flagged stale
     */
    int markMissing(String sourceId, Set<String> seenKeys, int staleAfterRuns);

    Gig findByKey(String key);

    /**
     * One write in a bulk request.
     *
     * @param gig   full document for {@link Type#UPSERT}, or the gig whose
     *              timestamps are bumped for {@link Type#TOUCH}
     * @param type  replace-or-insert by key, or timestamp bump only
     */
    record GigWrite(Gig gig, Type type) {

        public enum Type {
            UPSERT,
            TOUCH
        }

        public String key() {
            return gig.getIdentityKey();
        }
    }

    /**
     * Result of one write; {@code error} is null on success.
     */
    record WriteOutcome(String key, boolean success, String error) {

        public static WriteOutcome ok(String key) {
            return new WriteOutcome(key, true, null);
        }

        public static WriteOutcome failed(String key, String error) {
            return new WriteOutcome(key, false, error);
        }
    }
}
