package com.gigateer.ingestor.application.dedup;

import com.gigateer.ingestor.application.normalize.NormalizationUtils;
import com.gigateer.ingestor.domain.model.Gig;

import java.time.Instant;

/**
 * Derives the keys used to recognise the same event across scrapes.
 *
 * Format before hashing: {@code <sourceId>|<venueSlug>|<canonicalTitle>|<startInstant>}
 * Example: {@code bristol-the-croft|the-croft|band a|2024-05-01T20:00:00Z}
 */
public final class IdentityKeys {

    private IdentityKeys() {
    }

    public static String identityKey(String sourceId, String venueSlug, String canonicalTitle, Instant start) {
        return NormalizationUtils.sha256Hex(String.join("|", sourceId, venueSlug, canonicalTitle, start.toString()));
    }

    /**
     * Same as {@link #identityKey} without the source, so two sources listing
     * the same event produce the same fingerprint.
     */
    public static String fingerprint(String venueSlug, String canonicalTitle, Instant start) {
        return NormalizationUtils.sha256Hex(String.join("|", venueSlug, canonicalTitle, start.toString()));
    }

    /**
     * Sets identity key and fingerprint from the gig's canonical fields.
     */
    public static void assign(Gig gig) {
        String slug = gig.getVenue().getSlug();
        gig.setIdentityKey(identityKey(gig.getSourceId(), slug, gig.getCanonicalTitle(), gig.getStartInstant()));
        gig.setFingerprint(fingerprint(slug, gig.getCanonicalTitle(), gig.getStartInstant()));
    }
}
