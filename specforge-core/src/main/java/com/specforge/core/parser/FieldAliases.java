package com.specforge.core.parser;

import com.specforge.core.model.SpecMetadata;
import com.specforge.core.util.Slugs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static alias table mapping legacy front-matter field names to canonical ones.
 *
 * <p>Consulted once per parse. Also fills the defaults older documents omit:
 * format version, kind and a slug-derived id.
 */
public final class FieldAliases {

    /** Legacy name to canonical name. */
    public static final Map<String, String> ALIASES = Map.of(
        "maturity_level", SpecMetadata.MATURITY,
        "title", SpecMetadata.NAME,
        "author", SpecMetadata.OWNERS
    );

    public static final String DEFAULT_FORMAT_VERSION = "v3";
    public static final String DEFAULT_KIND = "FeatureSpec";
    public static final String ID_PREFIX = "feat-";

    private FieldAliases() {
        // Utility class
    }

    /**
     * Normalizes decoded front matter into canonical metadata.
     *
     * <p>A legacy field is copied only when its canonical counterpart is absent, so a
     * document declaring both keeps the canonical value.
     *
     * @param raw decoded front-matter fields
     * @return normalized metadata
     */
    public static SpecMetadata normalize(Map<String, Object> raw) {
        Map<String, Object> fields = new LinkedHashMap<>(raw);

        ALIASES.forEach((legacy, canonical) -> {
            if (fields.get(legacy) != null && fields.get(canonical) == null) {
                fields.put(canonical, fields.get(legacy));
            }
        });

        if (fields.get(SpecMetadata.OWNERS) instanceof String owner) {
            fields.put(SpecMetadata.OWNERS, List.of(Map.of("name", owner)));
        }

        if (isBlank(fields.get(SpecMetadata.FORMAT_VERSION))) {
            fields.put(SpecMetadata.FORMAT_VERSION, DEFAULT_FORMAT_VERSION);
        }

        if (isBlank(fields.get(SpecMetadata.KIND)) && fields.get("title") != null) {
            fields.put(SpecMetadata.KIND, DEFAULT_KIND);
        }

        if (isBlank(fields.get(SpecMetadata.ID)) && !isBlank(fields.get(SpecMetadata.NAME))) {
            String slug = Slugs.slugify(fields.get(SpecMetadata.NAME).toString());
            if (!slug.isEmpty()) {
                fields.put(SpecMetadata.ID, ID_PREFIX + slug);
            }
        }

        return new SpecMetadata(fields);
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
