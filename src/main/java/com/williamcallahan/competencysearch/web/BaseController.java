package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.errors.ApiErrorResponse;
import com.williamcallahan.competencysearch.domain.errors.CompetencyNotFoundException;
import com.williamcallahan.competencysearch.domain.errors.EncodingFailureException;
import com.williamcallahan.competencysearch.domain.errors.SearchFailureException;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.support.FailureMessages;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Base controller class translating the error taxonomy into standardized responses.
 *
 * <p>Validation problems map to 400, unknown identifiers to 404, retryable encoder and store
 * failures to 503 with a {@code Retry-After} header, and anything unexpected to a generic 500.</p>
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    private static final String MALFORMED_BODY_MESSAGE = "Malformed request body";
    private static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(ValidationException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /**
     * Covers syntactically broken JSON and enum tokens outside the accepted set.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadableBody) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_BODY_MESSAGE, unreadableBody);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException typeMismatch) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + typeMismatch.getName() + "'");
    }

    @ExceptionHandler(CompetencyNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(CompetencyNotFoundException notFound) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, notFound.getMessage());
    }

    @ExceptionHandler(EncodingFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleEncodingFailure(EncodingFailureException encodingFailure) {
        log.warn("[SEARCH] Encoding failed: {}", encodingFailure.getMessage());
        return exceptionBuilder.buildRetryableErrorResponse("Encoding service unavailable", encodingFailure.getMessage());
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleStorageFailure(StorageFailureException storageFailure) {
        log.warn("[STORE] Storage failed: {}", storageFailure.getMessage());
        return exceptionBuilder.buildRetryableErrorResponse("Vector store unavailable", storageFailure.getMessage());
    }

    @ExceptionHandler(SearchFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleSearchFailure(SearchFailureException searchFailure) {
        String branchDetails = searchFailure.branchFailures().stream()
                .map(failure -> failure.branch() + ": " + failure.failureType())
                .collect(Collectors.joining("; "));
        log.warn("[SEARCH] Hybrid search failed ({})", branchDetails);
        return exceptionBuilder.buildRetryableErrorResponse(searchFailure.getMessage(), branchDetails);
    }

    /**
     * Framework exceptions keep the status they declare; everything else is a generic 500.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception exception) {
        if (exception instanceof ErrorResponse errorResponse) {
            return exceptionBuilder.buildErrorResponse(
                    errorResponse.getStatusCode(), FailureMessages.sanitize(exception.getMessage()));
        }
        log.error("Unexpected error while handling request", exception);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE);
    }
}
