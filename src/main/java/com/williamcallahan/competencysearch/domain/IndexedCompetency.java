package com.williamcallahan.competencysearch.domain;

import java.util.Objects;

/**
 * A stored competency together with its identifier.
 *
 * @param identifier store identifier (UUID string)
 * @param competency stored payload
 */
public record IndexedCompetency(String identifier, Competency competency) {

    public IndexedCompetency {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(competency, "competency");
    }
}
