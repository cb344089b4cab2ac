package com.gigateer.ingestor.application.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NormalizationUtils.
 */
class NormalizationUtilsTest {

    @Test
    void testCanonicalText() {
        // Test lower case conversion
        assertEquals("idles", NormalizationUtils.canonicalText("IDLES"));

        // Test accent removal
        assertEquals("sigur ros", NormalizationUtils.canonicalText("Sigur Rós"));

        // Test punctuation collapsed to one space
        assertEquals("the croft bristol", NormalizationUtils.canonicalText("The Croft,  Bristol!"));

        // Test letters outside the Latin alphabet are kept
        assertEquals("mø", NormalizationUtils.canonicalText("MØ"));
        assertEquals("東京事変 live", NormalizationUtils.canonicalText("東京事変 - Live!"));

        // Test leading/trailing removal
        assertEquals("value", NormalizationUtils.canonicalText(" value "));
    }

    @Test
    void testSlugify() {
        assertEquals("the-croft", NormalizationUtils.slugify("The Croft"));
        assertEquals("cafe-kino", NormalizationUtils.slugify("Café Kino"));
        assertEquals("", NormalizationUtils.slugify("???"));
    }

    @Test
    void testCollapseWhitespace() {
        assertEquals("Band A", NormalizationUtils.collapseWhitespace("  Band  A \n"));
        assertNull(NormalizationUtils.collapseWhitespace("   "));
        assertNull(NormalizationUtils.collapseWhitespace(null));
    }

    @Test
    void testCanonicalTextWithNullOrEmpty() {
        assertEquals("", NormalizationUtils.canonicalText(null));
        assertEquals("", NormalizationUtils.canonicalText(""));
        assertEquals("", NormalizationUtils.canonicalText("   "));
    }

    @Test
    void testSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            NormalizationUtils.sha256Hex("abc"));
    }
}
