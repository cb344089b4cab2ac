package com.gigateer.ingestor.application.dedup;

import com.gigateer.ingestor.application.normalize.ContentHasher;
import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.MergeAction;
import com.gigateer.ingestor.domain.model.NormalizedGig;
import com.gigateer.ingestor.domain.model.Performance;
import com.gigateer.ingestor.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides, for each normalized gig of a run, whether it is new, changed,
 * unchanged or a repeat of an earlier record in the same batch.
 *
 * Merge rules:
 * - first record in scrape order wins a duplicate key, later ones are SKIP
 * - unknown key: CREATE
 * - known key, different content hash: UPDATE, firstSeen and provenance kept
 * - known key, same content hash: UNCHANGED, only lastSeen/lastUpdated move
 * - unknown key whose fingerprint matches a gig created by another source:
 *   merged into that gig; its owner, key and listed fields are kept, this
 *   source only fills fields the owner left empty and is added to its
 *   provenance. UPDATE when that changed anything, otherwise UNCHANGED
 * - a gig with provenance keeps the gap-filled fields when its owner lists
 *   it again without them, so sources taking turns do not rewrite it
 */
public class GigDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(GigDeduplicator.class);

    private final ContentHasher contentHasher;

    public GigDeduplicator(ContentHasher contentHasher) {
        this.contentHasher = contentHasher;
    }

    public List<ClassifiedGig> classify(List<NormalizedGig> batch, Map<String, Gig> existingByKey, Instant now) {
        return classify(batch, existingByKey, Map.of(), now);
    }

    /**
     * @param batch                 normalized gigs of one run, in scrape order
     * @param existingByKey         stored gigs for the batch's identity keys
     * @param existingByFingerprint stored gigs for the batch's fingerprints
     * @param now                   timestamp applied to firstSeen/lastSeen/lastUpdated
     */
    public List<ClassifiedGig> classify(
            List<NormalizedGig> batch,
            Map<String, Gig> existingByKey,
            Map<String, Gig> existingByFingerprint,
            Instant now) {

        List<ClassifiedGig> classified = new ArrayList<>(batch.size());
        Set<String> seenKeys = new HashSet<>();

        for (NormalizedGig normalized : batch) {
            Gig incoming = normalized.gig();
            if (incoming.getIdentityKey() == null) {
                IdentityKeys.assign(incoming);
            }
            String key = incoming.getIdentityKey();

            if (!seenKeys.add(key)) {
                logger.debug("Skipping duplicate of {} within batch for source {}", key, incoming.getSourceId());
                classified.add(new ClassifiedGig(incoming, MergeAction.SKIP, normalized.raw()));
                continue;
            }

            Gig stored = existingByKey.get(key);
            if (stored != null) {
                classified.add(mergeSameSource(stored, incoming, normalized, now));
                continue;
            }

            Gig other = existingByFingerprint.get(incoming.getFingerprint());
            if (other != null && !other.getSourceId().equals(incoming.getSourceId())) {
                classified.add(mergeCrossSource(other, incoming, normalized, now));
                continue;
            }

            Gig created = incoming.copy();
            created.setFirstSeen(now);
            created.setLastSeen(now);
            created.setLastUpdated(now);
            created.setStale(false);
            created.setMissedRuns(0);
            classified.add(new ClassifiedGig(created, MergeAction.CREATE, normalized.raw()));
        }

        return classified;
    }

    private ClassifiedGig mergeSameSource(Gig stored, Gig incoming, NormalizedGig normalized, Instant now) {
        Gig merged = incoming.copy();
        merged.setFirstSeen(stored.getFirstSeen() != null ? stored.getFirstSeen() : now);
        merged.setProvenance(new ArrayList<>(stored.getProvenance()));
        if (!stored.getProvenance().isEmpty() && fillGaps(merged, stored)) {
            merged.setContentHash(contentHasher.hash(merged));
        }
        touch(merged, now);

        MergeAction action = sameHash(stored, merged) ? MergeAction.UNCHANGED : MergeAction.UPDATE;
        return new ClassifiedGig(merged, action, normalized.raw());
    }

    private ClassifiedGig mergeCrossSource(Gig stored, Gig incoming, NormalizedGig normalized, Instant now) {
        logger.warn("Gig {} from source {} matches gig {} created by source {}; keeping original owner",
            incoming.getIdentityKey(), incoming.getSourceId(), stored.getIdentityKey(), stored.getSourceId());

        Gig merged = stored.copy();
        if (merged.getFirstSeen() == null) {
            merged.setFirstSeen(now);
        }

        boolean filled = fillGaps(merged, incoming);
        if (filled) {
            merged.setContentHash(contentHasher.hash(merged));
        }

        boolean newProvenance = !merged.getProvenance().contains(incoming.getSourceId());
        if (newProvenance) {
            merged.getProvenance().add(incoming.getSourceId());
        }

        boolean newPerformances = merged.getPerformances().isEmpty() && !incoming.getPerformances().isEmpty();
        if (newPerformances) {
            List<Performance> performances = new ArrayList<>();
            for (Performance performance : incoming.getPerformances()) {
                performances.add(new Performance(stored.getIdentityKey(), performance.occurrence()));
            }
            merged.setPerformances(performances);
        }
        touch(merged, now);

        boolean changed = filled || newProvenance || newPerformances;
        MergeAction action = changed ? MergeAction.UPDATE : MergeAction.UNCHANGED;
        return new ClassifiedGig(merged, action, normalized.raw(), stored.getSourceId());
    }

    /**
     * Copies into {@code target} the fields it lacks and {@code donor} has.
     * Returns whether anything was filled.
     */
    private static boolean fillGaps(Gig target, Gig donor) {
        boolean filled = false;
        if (target.getDescription() == null && donor.getDescription() != null) {
            target.setDescription(donor.getDescription());
            filled = true;
        }
        if (target.getTicketUrl() == null && donor.getTicketUrl() != null) {
            target.setTicketUrl(donor.getTicketUrl());
            filled = true;
        }
        if (target.getEndInstant() == null && donor.getEndInstant() != null) {
            target.setEndInstant(donor.getEndInstant());
            filled = true;
        }
        if (target.getPrice() == null && donor.getPrice() != null) {
            target.setPrice(donor.getPrice());
            filled = true;
        }

        Venue venue = target.getVenue();
        Venue other = donor.getVenue();
        if (venue != null && other != null
                && (venue.getAddress() == null && other.getAddress() != null
                    || venue.getLocality() == null && other.getLocality() != null)) {
            // venue is shared with the stored copy, so replace rather than mutate
            target.setVenue(new Venue(
                venue.getName(),
                venue.getAddress() != null ? venue.getAddress() : other.getAddress(),
                venue.getLocality() != null ? venue.getLocality() : other.getLocality(),
                venue.getSlug()));
            filled = true;
        }
        return filled;
    }

    private static boolean sameHash(Gig stored, Gig merged) {
        return stored.getContentHash() != null && stored.getContentHash().equals(merged.getContentHash());
    }

    private static void touch(Gig gig, Instant now) {
        gig.setLastSeen(now);
        gig.setLastUpdated(now);
        gig.setStale(false);
        gig.setMissedRuns(0);
    }
}
