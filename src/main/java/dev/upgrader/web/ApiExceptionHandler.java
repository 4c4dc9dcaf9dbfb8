package dev.upgrader.web;

import dev.upgrader.error.HttpStatusException;
import dev.upgrader.error.ResolutionException;
import dev.upgrader.error.TransportException;
import dev.upgrader.error.ValidationException;
import dev.upgrader.service.EventBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Renders every API failure as {@code {"error": "..."}}. Engine failures are also
 * published on the event stream.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final EventBroadcaster events;

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return published(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<Map<String, String>> handleResolution(ResolutionException e) {
        return published(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler({HttpStatusException.class, TransportException.class})
    public ResponseEntity<Map<String, String>> handleUpstream(RuntimeException e) {
        log.warn("Catalog call failed: {}", e.getMessage());
        return published(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            return body(errorResponse.getStatusCode(), e.getMessage());
        }
        log.error("Unhandled API error: {}", e.getMessage(), e);
        return published(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<Map<String, String>> published(HttpStatus status, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        events.error(e.getClass().getSimpleName() + ": " + message);
        return body(status, message);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : "Error"));
    }
}
