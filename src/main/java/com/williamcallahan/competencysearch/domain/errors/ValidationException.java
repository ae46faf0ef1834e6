package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;

/**
 * Signals malformed input: a record missing required fields, a bad filter, or an invalid query.
 */
public class ValidationException extends CompetencySearchException {

    @Serial
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message, false);
    }
}
