package com.williamcallahan.competencysearch.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.CompetencyFilter;
import com.williamcallahan.competencysearch.domain.SearchMode;
import com.williamcallahan.competencysearch.domain.SearchQuery;
import java.util.List;

/**
 * Body of {@code POST /search/text}.
 *
 * @param text free-text query
 * @param searchType retrieval strategy, {@code semantic} when omitted
 * @param top maximum results, 10 when omitted
 * @param filters conjunctive filters, none when omitted
 */
public record SearchRequest(
        String text,
        @JsonProperty("search_type") SearchMode searchType,
        Integer top,
        List<CompetencyFilter> filters) {

    static final int DEFAULT_TOP = 10;

    SearchQuery toQuery() {
        return new SearchQuery(
                text,
                searchType == null ? SearchMode.SEMANTIC : searchType,
                top == null ? DEFAULT_TOP : top,
                filters);
    }
}
