package com.gigateer.ingestor.support;

import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.ports.GigRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gig store backed by a map. Individual keys can be made to reject writes
 * and the whole store can be taken offline.
 */
public class InMemoryGigRepository implements GigRepository {

    private final Map<String, Gig> gigs = new LinkedHashMap<>();
    private final Set<String> rejectedKeys = new HashSet<>();
    private final List<Integer> bulkSizes = new ArrayList<>();
    private boolean unavailable;

    public synchronized void rejectWritesFor(String key) {
        rejectedKeys.add(key);
    }

    public synchronized void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public synchronized void put(Gig gig) {
        gigs.put(gig.getIdentityKey(), gig.copy());
    }

    public synchronized int size() {
        return gigs.size();
    }

    public synchronized Collection<Gig> all() {
        return gigs.values();
    }

    public synchronized List<Integer> getBulkSizes() {
        return bulkSizes;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("store offline", new IllegalStateException("connection refused"));
        }
    }

    @Override
    public synchronized Map<String, Gig> findByKeys(Collection<String> keys) {
        checkAvailable();
        Map<String, Gig> found = new HashMap<>();
        for (String key : keys) {
            Gig gig = gigs.get(key);
            if (gig != null) {
                found.put(key, gig.copy());
            }
        }
        return found;
    }

    @Override
    public synchronized Map<String, Gig> findByFingerprints(Collection<String> fingerprints) {
        checkAvailable();
        Map<String, Gig> found = new HashMap<>();
        for (Gig gig : gigs.values()) {
            if (fingerprints.contains(gig.getFingerprint())) {
                found.putIfAbsent(gig.getFingerprint(), gig.copy());
            }
        }
        return found;
    }

    @Override
    public synchronized List<WriteOutcome> bulkUpsert(List<GigWrite> operations) {
        checkAvailable();
        bulkSizes.add(operations.size());
        List<WriteOutcome> outcomes = new ArrayList<>();
        for (GigWrite operation : operations) {
            String key = operation.key();
            if (rejectedKeys.contains(key)) {
                outcomes.add(WriteOutcome.failed(key, "E11000 duplicate key error"));
                continue;
            }
            if (operation.type() == GigWrite.Type.UPSERT) {
                gigs.put(key, operation.gig().copy());
            } else {
                Gig stored = gigs.get(key);
                if (stored == null) {
                    outcomes.add(WriteOutcome.failed(key, "no gig to touch"));
                    continue;
                }
                stored.setLastSeen(operation.gig().getLastSeen());
                stored.setLastUpdated(operation.gig().getLastUpdated());
                stored.setStale(false);
                stored.setMissedRuns(0);
            }
            outcomes.add(WriteOutcome.ok(key));
        }
        return outcomes;
    }

    @Override
    public synchronized int markMissing(String sourceId, Set<String> seenKeys, int staleAfterRuns) {
        checkAvailable();
        int flagged = 0;
        for (Gig gig : gigs.values()) {
            if (!gig.getSourceId().equals(sourceId) || seenKeys.contains(gig.getIdentityKey())) {
                continue;
            }
            gig.setMissedRuns(gig.getMissedRuns() + 1);
            if (!gig.isStale() && gig.getMissedRuns() >= staleAfterRuns) {
                gig.setStale(true);
                flagged++;
            }
        }
        return flagged;
    }

    @Override
    public synchronized Gig findByKey(String key) {
        Gig gig = gigs.get(key);
        return gig != null ? gig.copy() : null;
    }
}
