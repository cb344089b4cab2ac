package com.gigateer.ingestor.application.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Text utilities shared by the normalizer and the deduplicator.
 */
public final class NormalizationUtils {

    private NormalizationUtils() {
    }

    /**
     * Collapses runs of whitespace (including non-breaking spaces) into one
     * space and trims. Returns null for null or blank input.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return null;
        }
        String collapsed = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Normalizes text for use in keys.
     *
     * Rules:
     * 1. Remove accents (Café -> cafe)
     * 2. Convert to lower case
     * 3. Replace runs of anything but letters and digits (any script) with a single space
     * 4. Trim
     */
    public static String canonicalText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toLowerCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^\\p{L}\\p{N}]+", " ");

        return normalized.trim();
    }

    /**
     * Turns text into a slug: "The Croft, Bristol" -> "the-croft-bristol".
     * Letters outside Latin scripts are kept as they are.
     */
    public static String slugify(String text) {
        return canonicalText(text).replace(' ', '-');
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code value}.
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
