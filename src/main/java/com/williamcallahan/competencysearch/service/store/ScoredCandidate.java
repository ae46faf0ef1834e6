package com.williamcallahan.competencysearch.service.store;

import java.util.Objects;

/**
 * One ranked hit of a single retrieval branch.
 *
 * @param identifier store identifier
 * @param score branch score (higher is better)
 */
public record ScoredCandidate(String identifier, double score) {

    public ScoredCandidate {
        Objects.requireNonNull(identifier, "identifier");
    }
}
