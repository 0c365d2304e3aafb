package com.example.itemlifecycle.http;

import com.example.itemlifecycle.service.ItemLifecycleException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders every failure as {@code {"error": "..."}}. Internal exception text is logged, never sent.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static HttpStatus statusOf(ItemLifecycleException.Code code) {
        return switch (code) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DELETION_NOT_ALLOWED -> HttpStatus.FORBIDDEN;
            case STORE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(ItemLifecycleException.class)
    public ResponseEntity<Map<String, Object>> domainError(ItemLifecycleException ex) {
        if (ex.getCode() == ItemLifecycleException.Code.STORE_FAILURE) {
            log.error("{}: store operation failed", ex.getMessage(), ex.getCause());
        }
        return error(statusOf(ex.getCode()), ex.getMessage());
    }

    // Only POST /api/items takes a body, so an unreadable body means no usable name.
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return domainError(ItemLifecycleException.nameRequired());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework-level rejections (unknown route, wrong method, bad media type).
            HttpStatusCode status = errorResponse.getStatusCode();
            HttpStatus resolved = HttpStatus.resolve(status.value());
            String reason = resolved != null ? resolved.getReasonPhrase() : "Request rejected";
            return ResponseEntity.status(status).body(Map.of("error", reason));
        }
        log.error("Unexpected error handling request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
