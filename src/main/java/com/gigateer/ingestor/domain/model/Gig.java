package com.gigateer.ingestor.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical gig as stored in the catalog.
 *
 * <p>{@code identityKey} is derived from source, venue slug, canonical title
 * and start instant, so it survives re-scrapes of the same event.
 * {@code fingerprint} is the same derivation without the source and is only
 * used to spot the same event listed by two different sources.
 */
public class Gig {

    private String identityKey;

    private String fingerprint;

    /** Source that first created this gig. */
    private String sourceId;

    /** Other sources that later listed the same event. */
    private List<String> provenance = new ArrayList<>();

    private String title;

    /** Title used for key derivation: lower case, no accents or punctuation. */
    private String canonicalTitle;

    private Venue venue;

    /** Start instant in UTC. */
    private Instant startInstant;

    private Instant endInstant;

    private String description;

    private String ticketUrl;

    private PriceInfo price;

    private List<Performance> performances = new ArrayList<>();

    /** SHA-256 over the mutable fields, used for change detection. */
    private String contentHash;

    private Instant firstSeen;

    private Instant lastSeen;

    private Instant lastUpdated;

    /** Set once the gig has been missing from its source for too many runs. */
    private boolean stale;

    /** Consecutive runs of the owning source that did not list this gig. */
    private int missedRuns;

    /**
     * Shallow copy; nested venue, price and lists are shared.
     */
    public Gig copy() {
        Gig copy = new Gig();
        copy.identityKey = identityKey;
        copy.fingerprint = fingerprint;
        copy.sourceId = sourceId;
        copy.provenance = new ArrayList<>(provenance);
        copy.title = title;
        copy.canonicalTitle = canonicalTitle;
        copy.venue = venue;
        copy.startInstant = startInstant;
        copy.endInstant = endInstant;
        copy.description = description;
        copy.ticketUrl = ticketUrl;
        copy.price = price;
        copy.performances = new ArrayList<>(performances);
        copy.contentHash = contentHash;
        copy.firstSeen = firstSeen;
        copy.lastSeen = lastSeen;
        copy.lastUpdated = lastUpdated;
        copy.stale = stale;
        copy.missedRuns = missedRuns;
        return copy;
    }

    public String getIdentityKey() {
        return identityKey;
    }

    public void setIdentityKey(String identityKey) {
        this.identityKey = identityKey;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public List<String> getProvenance() {
        return provenance;
    }

    public void setProvenance(List<String> provenance) {
        this.provenance = provenance != null ? provenance : new ArrayList<>();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCanonicalTitle() {
        return canonicalTitle;
    }

    public void setCanonicalTitle(String canonicalTitle) {
        this.canonicalTitle = canonicalTitle;
    }

    public Venue getVenue() {
        return venue;
    }

    public void setVenue(Venue venue) {
        this.venue = venue;
    }

    public Instant getStartInstant() {
        return startInstant;
    }

    public void setStartInstant(Instant startInstant) {
        this.startInstant = startInstant;
    }

    public Instant getEndInstant() {
        return endInstant;
    }

    public void setEndInstant(Instant endInstant) {
        this.endInstant = endInstant;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getTicketUrl() {
        return ticketUrl;
    }

    public void setTicketUrl(String ticketUrl) {
        this.ticketUrl = ticketUrl;
    }

    public PriceInfo getPrice() {
        return price;
    }

    public void setPrice(PriceInfo price) {
        this.price = price;
    }

    public List<Performance> getPerformances() {
        return performances;
    }

    public void setPerformances(List<Performance> performances) {
        this.performances = performances != null ? performances : new ArrayList<>();
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(Instant firstSeen) {
        this.firstSeen = firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public boolean isStale() {
        return stale;
    }

    public void setStale(boolean stale) {
        this.stale = stale;
    }

    public int getMissedRuns() {
        return missedRuns;
    }

    public void setMissedRuns(int missedRuns) {
        this.missedRuns = missedRuns;
    }
}
