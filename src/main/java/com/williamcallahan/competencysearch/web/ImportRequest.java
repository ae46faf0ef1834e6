package com.williamcallahan.competencysearch.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.CompetencyType;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.importer.IndexedField;
import com.williamcallahan.competencysearch.importer.IndexingStrategyType;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /import}: one raw provider record plus how to map and index it.
 *
 * @param provider source taxonomy
 * @param competencyType competency kind
 * @param lang record language
 * @param indexingStrategy expansion strategy, {@code field_duplication} when omitted
 * @param fieldsToIndex fields the strategy reads, all of them when omitted
 * @param data raw record
 */
public record ImportRequest(
        Provider provider,
        @JsonProperty("competency_type") CompetencyType competencyType,
        Language lang,
        @JsonProperty("indexing_strategy") IndexingStrategyType indexingStrategy,
        @JsonProperty("fields_to_index") List<IndexedField> fieldsToIndex,
        Map<String, Object> data) {}
