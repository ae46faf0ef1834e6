package com.williamcallahan.competencysearch.service.filter;

import java.util.List;
import java.util.Set;

/**
 * Payload field names shared by filter translation, payload conversion and index creation.
 */
public final class CompetencyFieldSchema {

    public static final String METADATA_FIELD = "metadata";
    public static final String METADATA_PREFIX = METADATA_FIELD + ".";

    /** Top-level payload keys as they appear in stored documents. */
    public static final Set<String> TOP_LEVEL_FIELDS = Set.of(
            "code",
            "lang",
            "type",
            "provider",
            "title",
            "url",
            "category",
            "description",
            "keywords",
            "indexed_text",
            METADATA_FIELD);

    /** Fields that get a keyword payload index in Qdrant. */
    public static final List<String> KEYWORD_INDEX_FIELDS = List.of("lang", "type", "provider", "code");

    private CompetencyFieldSchema() {}

    /**
     * Reports whether a filter field addresses a stored value.
     *
     * @param field top-level field or dotted {@code metadata.} path
     * @return true for known top-level fields and well-formed metadata paths
     */
    public static boolean isKnownField(String field) {
        if (TOP_LEVEL_FIELDS.contains(field)) {
            return true;
        }
        if (!field.startsWith(METADATA_PREFIX)) {
            return false;
        }
        for (String segment : field.substring(METADATA_PREFIX.length()).split("\\.", -1)) {
            if (segment.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
