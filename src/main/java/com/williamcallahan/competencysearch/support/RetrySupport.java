package com.williamcallahan.competencysearch.support;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry utility for connection-level vector store failures.
 *
 * <p>Provides exponential backoff and only retries when {@link RetrievalErrorClassifier} reports the
 * failure as transient. Services above the store adapter never retry.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Default initial backoff duration. */
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);
    /** Default backoff multiplier. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Maximum backoff duration to prevent excessive waits. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

    private RetrySupport() {}

    /**
     * Executes a supplier with retry for transient failures.
     *
     * @param operation the operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least one
     * @param initialBackoff initial backoff duration
     * @param <T> return type
     * @return the result of the operation
     * @throws RuntimeException the last failure when retries are exhausted or the failure is not transient
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation, String operationName, int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Duration currentBackoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                if (!RetrievalErrorClassifier.isTransientVectorStoreError(exception)) {
                    throw exception;
                }
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s), giving up", operationName, attempt);
                    throw exception;
                }
                log.warn(
                        "{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName,
                        attempt,
                        maxAttempts,
                        currentBackoff.toMillis());
                sleep(currentBackoff);
                long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
            }
        }
    }

    private static void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
