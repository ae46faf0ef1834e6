package com.williamcallahan.competencysearch.domain;

import java.util.Objects;

/**
 * One ranked search hit.
 *
 * @param identifier store identifier of the competency
 * @param competency hydrated payload
 * @param score raw branch score for single-branch modes, normalized fused score in [0, 1] for hybrid
 */
public record SearchResult(String identifier, Competency competency, double score) {

    public SearchResult {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(competency, "competency");
    }
}
