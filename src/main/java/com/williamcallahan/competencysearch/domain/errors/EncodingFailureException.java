package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;

/**
 * Signals that the dense or sparse encoder is unavailable, timed out, or returned an invalid response.
 *
 * <p>Raised instead of returning synthetic vectors so callers never index or search with a placeholder.</p>
 */
public class EncodingFailureException extends CompetencySearchException {

    @Serial
    private static final long serialVersionUID = 1L;

    public EncodingFailureException(String message) {
        super(message, true);
    }

    public EncodingFailureException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
