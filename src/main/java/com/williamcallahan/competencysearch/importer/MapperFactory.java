package com.williamcallahan.competencysearch.importer;

import java.util.Map;

/**
 * Builds a mapper for one raw record of a given provider.
 */
@FunctionalInterface
public interface MapperFactory {

    /**
     * Creates the mapper.
     *
     * @param context provider, competency type and language of the import
     * @param rawRecord raw JSON object of one record
     * @return mapper for the record
     * @throws com.williamcallahan.competencysearch.domain.errors.ValidationException when the record
     *     lacks a required field or has a field of the wrong type
     */
    CompetencyMapper create(ImportContext context, Map<String, Object> rawRecord);
}
