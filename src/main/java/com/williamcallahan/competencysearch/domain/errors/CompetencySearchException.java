package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;

/**
 * Base type for every failure raised by the indexing and search services.
 *
 * <p>Callers decide whether to retry from {@link #isRetryable()}; the services themselves never retry.</p>
 */
public abstract class CompetencySearchException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final boolean retryable;

    protected CompetencySearchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected CompetencySearchException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Reports whether repeating the same call may succeed.
     *
     * @return true for transient failures such as timeouts and unavailable dependencies
     */
    public boolean isRetryable() {
        return retryable;
    }
}
