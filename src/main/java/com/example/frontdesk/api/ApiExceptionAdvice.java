package com.example.frontdesk.api;

import com.example.frontdesk.error.FrontdeskException;
import com.example.frontdesk.error.InvalidTransitionException;
import com.example.frontdesk.error.NotFoundException;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the service's failure taxonomy to JSON error bodies.
 *
 * <ul>
 *   <li>{@link ValidationException}, bean validation, unreadable body → 400</li>
 *   <li>{@link NotFoundException} → 404</li>
 *   <li>{@link InvalidTransitionException} → 409</li>
 *   <li>{@link UpstreamUnavailableException} → 503</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(FrontdeskException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(FrontdeskException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.warn("[API] {} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(status, ex.code(), ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError first = ex.getBindingResult().getFieldError();
        String message = first == null ? "invalid request" : first.getField() + ": " + first.getDefaultMessage();
        if (first != null && first.getDefaultMessage() != null && first.getDefaultMessage().endsWith("is required")) {
            message = first.getDefaultMessage();
        }
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "validation_failed", message, request));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "validation_failed", "request body is missing or malformed", request));
    }

    static HttpStatus statusOf(FrontdeskException ex) {
        if (ex instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof InvalidTransitionException) return HttpStatus.CONFLICT;
        if (ex instanceof UpstreamUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", message);
        if (request != null) {
            out.put("path", request.getRequestURI());
        }
        out.put("timestamp", Instant.now().toString());

        String callId = MDC.get("callId");
        if (callId != null && !callId.isBlank()) {
            out.put("callId", callId);
        }
        return out;
    }
}
