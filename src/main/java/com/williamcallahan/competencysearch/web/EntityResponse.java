package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.IndexedCompetency;

/**
 * A stored competency with its identifier.
 *
 * @param identifier UUID string
 * @param competency stored payload
 */
public record EntityResponse(String identifier, Competency competency) {

    static EntityResponse from(IndexedCompetency indexedCompetency) {
        return new EntityResponse(indexedCompetency.identifier(), indexedCompetency.competency());
    }
}
