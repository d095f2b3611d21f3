package com.phillippitts.transcribe.presentation.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phillippitts.transcribe.config.logging.MdcFilter;
import com.phillippitts.transcribe.exception.FileTooLargeException;
import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.exception.InvalidParameterException;
import com.phillippitts.transcribe.exception.ModelUnavailableException;
import com.phillippitts.transcribe.exception.StorageException;
import com.phillippitts.transcribe.exception.UnsupportedFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Duration;
import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * <p>Maps each failure kind to exactly one status code:
 * <ul>
 *   <li>400: unsupported format, out-of-range parameter, missing or malformed upload</li>
 *   <li>413: upload over the size limit</li>
 *   <li>503: model not ready, failed to load, or busy ({@code Retry-After} unless the load failed)</li>
 *   <li>500: storage and inference failures, anything unexpected</li>
 * </ul>
 *
 * <p>Logs full diagnostics while keeping paths, stderr and stack traces out of responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - file has no name or a disallowed extension (HTTP 400).
     */
    @ExceptionHandler(UnsupportedFormatException.class)
    ResponseEntity<ApiError> handleUnsupportedFormat(UnsupportedFormatException ex) {
        LOG.warn("Unsupported upload: extension='{}'", ex.getExtension());
        return error(HttpStatus.BAD_REQUEST, "UnsupportedFormat", ex.getMessage());
    }

    /**
     * Client error - parameter out of range (HTTP 400).
     */
    @ExceptionHandler(InvalidParameterException.class)
    ResponseEntity<ApiError> handleInvalidParameter(InvalidParameterException ex) {
        LOG.warn("Invalid parameter '{}': {}", ex.getParameter(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidParameter", ex.getMessage());
    }

    /**
     * Client error - multipart request without a {@code file} part (HTTP 400).
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    ResponseEntity<ApiError> handleMissingPart(MissingServletRequestPartException ex) {
        LOG.warn("Missing request part '{}'", ex.getRequestPartName());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "No file uploaded");
    }

    /**
     * Client error - parameter not parseable as its type (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Unparseable parameter '{}'", ex.getName());
        return error(HttpStatus.BAD_REQUEST, "InvalidParameter", "Invalid value for parameter: " + ex.getName());
    }

    /**
     * Client error - upload over the limit (HTTP 413).
     */
    @ExceptionHandler(FileTooLargeException.class)
    ResponseEntity<ApiError> handleFileTooLarge(FileTooLargeException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "FileTooLarge", ex.getMessage());
    }

    /**
     * Client error - container-level multipart limit hit (HTTP 413).
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected by multipart limit: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "FileTooLarge", "File too large");
    }

    /**
     * Client error - body is not a readable multipart request (HTTP 400).
     */
    @ExceptionHandler(MultipartException.class)
    ResponseEntity<ApiError> handleMultipart(MultipartException ex) {
        LOG.warn("Malformed multipart request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid multipart request");
    }

    /**
     * Model not ready (HTTP 503). A load failure is terminal, so it carries no Retry-After.
     */
    @ExceptionHandler(ModelUnavailableException.class)
    ResponseEntity<ApiError> handleModelUnavailable(ModelUnavailableException ex) {
        String detail = switch (ex.getReason()) {
            case LOADING_TIMEOUT -> "Speech model is still loading. Please retry later.";
            case LOAD_FAILED -> "Speech model failed to load. Contact administrator.";
            case BUSY -> "All transcription slots are busy. Please retry later.";
            case INTERRUPTED -> "Request interrupted while waiting for the speech model.";
        };
        if (ex.getReason() == ModelUnavailableException.Reason.LOAD_FAILED) {
            LOG.error("Model unavailable: {}", ex.getMessage());
        } else {
            LOG.warn("Model unavailable ({}): {}", ex.getReason(), ex.getMessage());
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE);
        Duration retryAfter = ex.getRetryAfter();
        if (retryAfter != null && ex.getReason() != ModelUnavailableException.Reason.LOAD_FAILED) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, retryAfter.toSeconds())));
        }
        return builder.body(apiError("ModelUnavailable", detail));
    }

    /**
     * Server error - upload could not be written (HTTP 500).
     */
    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOG.error("Storage failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "StorageError", "Failed to save uploaded file");
    }

    /**
     * Server error - engine failed; never retried here (HTTP 500).
     */
    @ExceptionHandler(InferenceException.class)
    ResponseEntity<ApiError> handleInference(InferenceException ex) {
        LOG.error("Transcription failed: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InferenceError", "Transcription failed: " + ex.getReason());
    }

    /**
     * Catch-all. Framework exceptions keep their own status (405, 415, ...);
     * anything else is an unexpected error (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework && !framework.getStatusCode().is5xxServerError()) {
            HttpStatusCode status = framework.getStatusCode();
            LOG.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                    .body(apiError("BadRequest", framework.getBody().getDetail()));
        }
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred. Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(apiError(error, detail));
    }

    private static ApiError apiError(String error, String detail) {
        return new ApiError(error, detail, ThreadContext.get(MdcFilter.REQUEST_ID_KEY), Instant.now().toString());
    }

    /**
     * Standardized error response for API clients.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ApiError(
        String error,
        String detail,
        String requestId,
        String timestamp
    ) {}
}
