package com.williamcallahan.competencysearch.domain;

import java.util.List;

/**
 * Search request accepted by the hybrid search service.
 *
 * @param text free-text query
 * @param mode retrieval strategy
 * @param top maximum number of results
 * @param filters conjunctive filter conditions
 */
public record SearchQuery(String text, SearchMode mode, int top, List<CompetencyFilter> filters) {

    public SearchQuery {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
