package com.di.scorenova.exception;

import com.di.scorenova.util.MdcPropagation;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST API to a structured {@link ErrorResponse}
 * carrying the {@link ErrorCategory}.
 *
 * <table>
 *   <tr><th>Exception</th><th>Status</th></tr>
 *   <tr><td>{@link ValidationException}, bad request body</td><td>400</td></tr>
 *   <tr><td>{@link ConfigurationException}</td><td>503</td></tr>
 *   <tr><td>{@link StorageException}</td><td>502</td></tr>
 *   <tr><td>anything else</td><td>500</td></tr>
 * </table>
 *
 * <p>To handle a specific exception type:
 * <pre>{@code
 * @ExceptionHandler(YourException.class)
 * public ResponseEntity<ErrorResponse> handleYourException(YourException e, WebRequest request) {
 *     return respond("YOUR_EXCEPTION", e, HttpStatus.BAD_REQUEST, request);
 * }
 * }</pre>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e, WebRequest request) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequestBody(Exception e, WebRequest request) {
        ResponseEntity<ErrorResponse> response = respond("BAD_REQUEST_BODY", e, HttpStatus.BAD_REQUEST, request);
        ErrorResponse body = response.getBody();
        if (body != null) {
            body.setErrorCategory(ErrorCategory.VALIDATION_ERROR.name());
            body.setErrorCategoryName(ErrorCategory.VALIDATION_ERROR.getName());
            body.setErrorCategoryDescription(ErrorCategory.VALIDATION_ERROR.getDescription());
        }
        return response;
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(ConfigurationException e, WebRequest request) {
        return respond("CONFIGURATION_EXCEPTION", e, HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageException(StorageException e, WebRequest request) {
        return respond("STORAGE_EXCEPTION", e, HttpStatus.BAD_GATEWAY, request);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, WebRequest request) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable e, HttpStatus status, WebRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e, status);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status, request));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, HttpStatus status) {
        String runId = MDC.get(MdcPropagation.RUN_ID);
        if (status.is5xxServerError()) {
            log.error("[API] {} [{}] runId={}: {}", eventType, category.getName(), runId, exception.getMessage(), exception);
        } else {
            log.warn("[API] {} [{}]: {}", eventType, category.getName(), exception.getMessage());
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status, WebRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request instanceof ServletWebRequest
                ? ((ServletWebRequest) request).getRequest().getRequestURI()
                : "/unknown");

        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
