package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.Competency;

/**
 * Body of the entity create and replace endpoints.
 *
 * @param competency record to index
 */
public record EntityRequest(Competency competency) {}
