package com.williamcallahan.competencysearch.service.store;

import com.google.common.util.concurrent.ListenableFuture;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.support.FailureMessages;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class QdrantFutureAwaiter {

    private QdrantFutureAwaiter() {}

    /**
     * Blocks on a Qdrant client future, mapping every failure to {@link StorageFailureException}.
     *
     * <p>The original cause stays attached so retry classification can inspect the gRPC status.</p>
     */
    public static <T> T awaitFuture(ListenableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StorageFailureException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            throw new StorageFailureException(
                    "Qdrant " + operation + " failed: " + FailureMessages.describe(cause), cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new StorageFailureException(
                    "Qdrant " + operation + " timed out after " + timeout.toMillis() + "ms", timeoutException);
        }
    }
}
