package com.gigateer.ingestor.domain.model;

/**
 * Per-run record counters.
 *
 * <p>At run close {@code created + updated + unchanged + failed + skipped == scraped}.
 */
public class RunCounts {

    private int scraped;
    private int created;
    private int updated;
    private int unchanged;
    private int failed;
    private int skipped;

    public RunCounts() {
    }

    public RunCounts(int scraped, int created, int updated, int unchanged, int failed, int skipped) {
        this.scraped = scraped;
        this.created = created;
        this.updated = updated;
        this.unchanged = unchanged;
        this.failed = failed;
        this.skipped = skipped;
    }

    public int succeeded() {
        return created + updated + unchanged;
    }

    public boolean isBalanced() {
        return succeeded() + failed + skipped == scraped;
    }

    public void addScraped(int n) {
        scraped += n;
    }

    public void addCreated(int n) {
        created += n;
    }

    public void addUpdated(int n) {
        updated += n;
    }

    public void addUnchanged(int n) {
        unchanged += n;
    }

    public void addFailed(int n) {
        failed += n;
    }

    public void addSkipped(int n) {
        skipped += n;
    }

    public int getScraped() {
        return scraped;
    }

    public void setScraped(int scraped) {
        this.scraped = scraped;
    }

    public int getCreated() {
        return created;
    }

    public void setCreated(int created) {
        this.created = created;
    }

    public int getUpdated() {
        return updated;
    }

    public void setUpdated(int updated) {
        this.updated = updated;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public void setUnchanged(int unchanged) {
        this.unchanged = unchanged;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public int getSkipped() {
        return skipped;
    }

    public void setSkipped(int skipped) {
        this.skipped = skipped;
    }

    @Override
    public String toString() {
        return String.format("scraped=%d created=%d updated=%d unchanged=%d failed=%d skipped=%d",
            scraped, created, updated, unchanged, failed, skipped);
    }
}
