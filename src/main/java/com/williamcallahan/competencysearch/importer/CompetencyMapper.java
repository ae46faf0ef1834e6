package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.Competency;

/**
 * Turns one raw provider record into the canonical competency.
 *
 * <p>Cleaning and normalization of provider quirks happen here, never in the search core.</p>
 */
public interface CompetencyMapper {

    /**
     * Maps the raw record.
     *
     * @return cleaned competency
     */
    Competency toCompetency();
}
