package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.errors.ApiErrorResponse;
import com.williamcallahan.competencysearch.support.FailureMessages;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /** Seconds a client should wait before retrying a transient failure. */
    static final String RETRY_AFTER_SECONDS = "1";

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status HTTP status code
     * @param message error message
     * @return response with error payload
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message and exception details.
     *
     * @param status HTTP status code
     * @param message error message
     * @param exception exception that occurred
     * @return response with error payload
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(
            HttpStatusCode status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds a 503 response for a retryable failure, with a {@code Retry-After} header.
     *
     * @param message error message
     * @param details diagnostic details, may be {@code null}
     * @return response with error payload
     */
    public ResponseEntity<ApiErrorResponse> buildRetryableErrorResponse(String message, String details) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(ApiErrorResponse.error(message, details));
    }

    /**
     * Describes an exception for client diagnostics.
     *
     * @param exception exception to describe
     * @return sanitized description, or {@code null} when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        return FailureMessages.sanitize(FailureMessages.describe(exception));
    }
}
