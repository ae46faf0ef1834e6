package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.WireTokens;
import java.util.List;
import java.util.function.Function;

/**
 * Competency fields an indexing strategy can derive indexed text from.
 */
public enum IndexedField {
    TITLE("title", competency -> single(competency.title())),
    DESCRIPTION("description", competency -> single(competency.description())),
    CATEGORY("category", competency -> single(competency.category())),
    KEYWORDS("keywords", competency -> competency.keywords() == null ? List.of() : competency.keywords());

    /** Every field, in the order used when none is requested. */
    public static final List<IndexedField> ALL = List.of(TITLE, DESCRIPTION, CATEGORY, KEYWORDS);

    private final String token;
    private final Function<Competency, List<String>> extractor;

    IndexedField(String token, Function<Competency, List<String>> extractor) {
        this.token = token;
        this.extractor = extractor;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static IndexedField fromToken(String token) {
        return WireTokens.resolve(IndexedField.class, values(), IndexedField::token, token);
    }

    /**
     * Values of this field; a scalar field yields at most one value.
     */
    List<String> valuesOf(Competency competency) {
        return extractor.apply(competency);
    }

    /**
     * Whether the field holds a list rather than a single value.
     */
    boolean isList() {
        return this == KEYWORDS;
    }

    private static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }
}
