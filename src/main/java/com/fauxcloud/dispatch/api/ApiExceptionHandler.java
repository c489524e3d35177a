package com.fauxcloud.dispatch.api;

import com.fauxcloud.core.error.InstanceException;
import com.fauxcloud.core.error.InvalidStateException;
import com.fauxcloud.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps lifecycle errors to HTTP responses with a JSON body of {@code error}, {@code kind} and details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InstanceException.class)
    public ResponseEntity<Map<String, Object>> handleInstanceException(InstanceException e) {
        HttpStatus status = switch (e.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case RESOURCE_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case FATAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed for instance {}: {}", e.instanceId(), e.getMessage(), e);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("kind", e.kind().name());
        if (e.instanceId() != null) {
            body.put("instance_id", e.instanceId());
        }
        if (e instanceof ValidationException validation) {
            body.put("violations", validation.violations());
        }
        if (e instanceof InvalidStateException invalidState) {
            body.put("current_status", invalidState.currentStatus().name());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Malformed request: " + e.getMessage());
        body.put("kind", "VALIDATION");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InterruptedException.class)
    public ResponseEntity<Map<String, Object>> handleInterrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "Request interrupted"));
    }
}
