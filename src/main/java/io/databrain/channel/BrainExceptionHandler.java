package io.databrain.channel;

import io.databrain.error.BrainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps brain failures to HTTP statuses: validation 400, not found 404, conflict 409,
 * store unavailable 503.
 */
@RestControllerAdvice
public class BrainExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BrainExceptionHandler.class);

    @ExceptionHandler(BrainException.class)
    public ResponseEntity<Map<String, Object>> handleBrainException(BrainException e) {
        HttpStatus status = switch (e.kind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (status.is5xxServerError()) {
            log.error("Brain request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Brain request rejected ({}): {}", e.kind(), e.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind().name());
        body.put("message", e.getMessage());
        body.put("retryable", e.isRetryable());
        return ResponseEntity.status(status).body(body);
    }
}
