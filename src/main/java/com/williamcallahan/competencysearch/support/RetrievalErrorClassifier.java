package com.williamcallahan.competencysearch.support;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.net.ConnectException;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies vector store failures as connection-level transient errors or permanent ones.
 */
public final class RetrievalErrorClassifier {

    private static final Set<Status.Code> TRANSIENT_GRPC_CODES =
            EnumSet.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED, Status.Code.RESOURCE_EXHAUSTED);

    private RetrievalErrorClassifier() {}

    /**
     * Determines whether the exception is a transient connection-level store error worth another attempt.
     *
     * <p>Transient errors are gRPC {@code UNAVAILABLE}, {@code DEADLINE_EXCEEDED} and
     * {@code RESOURCE_EXHAUSTED} and refused connections. Client-side operation timeouts, invalid
     * requests, missing collections and schema mismatches are not retried.</p>
     *
     * @param error the exception to classify
     * @return true if the error is transient
     */
    public static boolean isTransientVectorStoreError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StatusRuntimeException statusRuntimeException) {
                return TRANSIENT_GRPC_CODES.contains(statusRuntimeException.getStatus().getCode());
            }
            if (current instanceof StatusException statusException) {
                return TRANSIENT_GRPC_CODES.contains(statusException.getStatus().getCode());
            }
            if (current instanceof ConnectException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    /**
     * Determine a stable error category for logs and branch failure records.
     *
     * @param error failure encountered during retrieval
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StatusRuntimeException statusRuntimeException) {
                return "gRPC " + statusRuntimeException.getStatus().getCode();
            }
            if (current instanceof StatusException statusException) {
                return "gRPC " + statusException.getStatus().getCode();
            }
            if (current instanceof TimeoutException) {
                return "Timeout";
            }
            if (current instanceof ConnectException) {
                return "Connection Error";
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return error == null ? "Unknown Error" : error.getClass().getSimpleName();
    }
}
