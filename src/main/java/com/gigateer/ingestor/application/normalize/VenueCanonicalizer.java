package com.gigateer.ingestor.application.normalize;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves raw venue names to a canonical slug using an alias table.
 *
 * <p>Alias keys and lookups are both reduced with
 * {@link NormalizationUtils#canonicalText}, so "THE  CROFT" and "The Croft"
 * hit the same entry.
 */
public class VenueCanonicalizer {

    private final Map<String, String> aliases;

    public VenueCanonicalizer(Map<String, String> aliasTable) {
        Map<String, String> canonical = new HashMap<>();
        aliasTable.forEach((alias, target) -> canonical.put(NormalizationUtils.canonicalText(alias), target));
        this.aliases = canonical;
    }

    /**
     * @return canonical slug, empty when the name has no letters or digits
     */
    public String toSlug(String rawName) {
        String key = NormalizationUtils.canonicalText(rawName);
        String target = aliases.get(key);
        return NormalizationUtils.slugify(target != null ? target : key);
    }
}
