package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;

/**
 * Signals that a vector store operation failed or timed out.
 */
public class StorageFailureException extends CompetencySearchException {

    @Serial
    private static final long serialVersionUID = 1L;

    public StorageFailureException(String message) {
        super(message, true);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
