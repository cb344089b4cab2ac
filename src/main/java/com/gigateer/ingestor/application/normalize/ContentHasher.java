package com.gigateer.ingestor.application.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gigateer.ingestor.domain.model.Gig;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hashes the mutable content of a gig for change detection.
 *
 * <p>Fields are serialised as JSON with sorted keys, then SHA-256'd, so the
 * hash only changes when one of title, venue slug, start, end, description
 * or ticket URL changes.
 */
public class ContentHasher {

    private final ObjectMapper objectMapper;

    public ContentHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String hash(Gig gig) {
        Map<String, Object> content = new TreeMap<>();
        content.put("title", gig.getTitle());
        content.put("venueSlug", gig.getVenue() != null ? gig.getVenue().getSlug() : null);
        content.put("startInstant", iso(gig.getStartInstant()));
        content.put("endInstant", iso(gig.getEndInstant()));
        content.put("description", gig.getDescription());
        content.put("ticketUrl", gig.getTicketUrl());

        try {
            return NormalizationUtils.sha256Hex(objectMapper.writeValueAsString(content));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise gig content for hashing", e);
        }
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
