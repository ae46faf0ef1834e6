package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.CompetencyType;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;

/**
 * Attributes shared by every record of one import call.
 *
 * @param provider source taxonomy
 * @param type competency kind
 * @param lang record language
 */
public record ImportContext(Provider provider, CompetencyType type, Language lang) {

    public ImportContext {
        if (provider == null) {
            throw new ValidationException("Import provider is required");
        }
        if (type == null) {
            throw new ValidationException("Import competency_type is required");
        }
        if (lang == null) {
            throw new ValidationException("Import lang is required");
        }
    }
}
