package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.Competency;
import java.util.List;

/**
 * Expands one mapped competency into the records that get indexed.
 */
public interface IndexingStrategy {

    /**
     * Expands a competency.
     *
     * @param competency mapped competency
     * @return records to index, each with its own indexed text
     */
    List<Competency> expand(Competency competency);
}
