package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.SearchResult;
import java.util.List;

/**
 * Ranked results of one search.
 *
 * @param results hits by descending score
 */
public record SearchResponse(List<SearchResult> results) {

    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
