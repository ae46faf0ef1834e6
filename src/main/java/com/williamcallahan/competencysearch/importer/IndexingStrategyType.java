package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.williamcallahan.competencysearch.domain.WireTokens;
import java.util.List;

/**
 * How a mapped competency is expanded into indexed records.
 */
public enum IndexingStrategyType {
    /** One record per field value. */
    FIELD_DUPLICATION("field_duplication"),
    /** One record whose text combines every selected field. */
    FIELD_COMBINATION("field_combination");

    private final String token;

    IndexingStrategyType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static IndexingStrategyType fromToken(String token) {
        return WireTokens.resolve(IndexingStrategyType.class, values(), IndexingStrategyType::token, token);
    }

    /**
     * Builds the strategy over the given fields, all of them when none is given.
     *
     * @param fields selected fields, may be null or empty
     * @return strategy instance
     */
    public IndexingStrategy create(List<IndexedField> fields) {
        List<IndexedField> selected = fields == null || fields.isEmpty() ? IndexedField.ALL : List.copyOf(fields);
        return switch (this) {
            case FIELD_DUPLICATION -> new FieldDuplicationStrategy(selected);
            case FIELD_COMBINATION -> new FieldCombinationStrategy(selected);
        };
    }
}
