package com.di.organizer.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the production order API.
 *
 * <p>Store operations report failures as {@code false}, so exceptions that reach this class come from
 * request handling (unreadable JSON, failed bean validation, bad path variables) or are genuine bugs.
 * Bad input maps to 400, everything else to 500, both in the {@link ApiErrorResponse} envelope below.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles a missing or unparsable JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logWarn("UNREADABLE_BODY", category, e);
        ApiErrorResponse body = buildErrorResponse(category, HttpStatus.BAD_REQUEST, "Request body is missing or is not valid JSON");
        body.addDetail("exceptionType", e.getClass().getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handles bean validation failures on request bodies (e.g. missing {@code data}).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logWarn("INVALID_BODY", category, e);
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        ApiErrorResponse body = buildErrorResponse(category, HttpStatus.BAD_REQUEST,
                message.isEmpty() ? "Request body is invalid" : message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handles path variables of the wrong type (e.g. a non-numeric order index).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logWarn("TYPE_MISMATCH", category, e);
        ApiErrorResponse body = buildErrorResponse(category, HttpStatus.BAD_REQUEST,
                "Invalid value '" + e.getValue() + "' for parameter '" + e.getName() + "'");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handles validation errors (IllegalArgumentException, IllegalStateException).
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ApiErrorResponse> handleValidationException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logWarn("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(category, HttpStatus.BAD_REQUEST, messageOf(e)));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logWarn("UPLOAD_TOO_LARGE", category, e);
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(buildErrorResponse(category, HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file is too large"));
    }

    /**
     * Handles all other exceptions. Spring MVC exceptions that carry their own status
     * (unsupported media type, unknown route, wrong method, missing part) keep it.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (e instanceof ErrorResponse) {
            HttpStatusCode statusCode = ((ErrorResponse) e).getStatusCode();
            HttpStatus status = HttpStatus.resolve(statusCode.value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            logWarn("WEB_EXCEPTION", category, e);
            return ResponseEntity.status(status).body(buildErrorResponse(category, status, messageOf(e)));
        }
        log.error("GlobalExceptionHandler caught exception: {} [{}] path={}",
                e.getClass().getSimpleName(), category.getName(), getRequestPath(), e);
        ApiErrorResponse body = buildErrorResponse(category, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        body.addDetail("exceptionType", e.getClass().getName());
        Throwable rootCause = getRootCause(e);
        if (rootCause != e) {
            body.addDetail("rootCauseType", rootCause.getClass().getName());
            body.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private void logWarn(String eventType, ErrorCategory category, Throwable exception) {
        log.warn("{} [{}] path={} requestId={}: {}", eventType, category.getName(), getRequestPath(),
                MDC.get("requestId"), messageOf(exception));
    }

    /**
     * Builds a structured error response.
     */
    private ApiErrorResponse buildErrorResponse(ErrorCategory category, HttpStatus status, String message) {
        ApiErrorResponse response = new ApiErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(message);
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        return response;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Gets the root cause of an exception.
     */
    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Gets the request path from MDC (set by MdcRequestFilter) or returns default.
     */
    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ApiErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getErrorCategoryDescription() {
            return errorCategoryDescription;
        }

        public void setErrorCategoryDescription(String errorCategoryDescription) {
            this.errorCategoryDescription = errorCategoryDescription;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
