package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical competency record shared by every provider.
 *
 * <p>The record is the stored payload. Its identifier lives outside of it, as the point id of the
 * vector store. {@code metadata} is an open nested map that is only reachable from filters through
 * {@code metadata.<path>} fields.</p>
 *
 * @param code source-local identifier (required)
 * @param lang record language (required)
 * @param type competency kind (required)
 * @param provider source taxonomy (required)
 * @param title display title (required)
 * @param url canonical page for the record in its source taxonomy
 * @param category free-text category
 * @param description free-text description
 * @param keywords ordered keywords
 * @param indexedText text the vectors are computed from
 * @param metadata open nested attributes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Competency(
        String code,
        Language lang,
        CompetencyType type,
        Provider provider,
        String title,
        String url,
        String category,
        String description,
        List<String> keywords,
        @JsonProperty("indexed_text") String indexedText,
        Map<String, Object> metadata) {

    public Competency {
        keywords = keywords == null ? null : List.copyOf(keywords);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy of this record with another indexed text.
     *
     * @param replacementText new indexed text
     * @return copied record
     */
    public Competency withIndexedText(String replacementText) {
        return new Competency(
                code, lang, type, provider, title, url, category, description, keywords, replacementText, metadata);
    }

    /**
     * Reports whether an explicit, non-blank indexed text is present.
     */
    @JsonIgnore
    public boolean hasIndexedText() {
        return indexedText != null && !indexedText.isBlank();
    }

    /**
     * Lists the names of required fields that are missing or blank.
     *
     * @return missing field names in declaration order, empty when the record is complete
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (code == null || code.isBlank()) {
            missing.add("code");
        }
        if (lang == null) {
            missing.add("lang");
        }
        if (type == null) {
            missing.add("type");
        }
        if (provider == null) {
            missing.add("provider");
        }
        if (title == null || title.isBlank()) {
            missing.add("title");
        }
        return List.copyOf(missing);
    }
}
