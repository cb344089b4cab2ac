package com.gigateer.ingestor.domain.model;

/**
 * Venue a gig takes place at. Several sources may name the same venue
 * differently; {@link #slug} is the canonical form shared between them.
 */
public class Venue {

    /** Display name as listed by the source, whitespace collapsed. */
    private String name;

    /** Street address (optional). */
    private String address;

    /** Town or city (optional), e.g. "Bristol". */
    private String locality;

    /** Canonical slug, e.g. "the-croft". */
    private String slug;

    public Venue() {
    }

    public Venue(String name, String address, String locality, String slug) {
        this.name = name;
        this.address = address;
        this.locality = locality;
        this.slug = slug;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getLocality() {
        return locality;
    }

    public void setLocality(String locality) {
        this.locality = locality;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }
}
