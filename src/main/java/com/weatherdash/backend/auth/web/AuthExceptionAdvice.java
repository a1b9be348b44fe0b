package com.weatherdash.backend.auth.web;

import com.weatherdash.backend.common.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(basePackages = "com.weatherdash.backend.auth")
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AuthExceptionAdvice {

    @ExceptionHandler(AuthFlowException.class)
    public ResponseEntity<Map<String, Object>> handleAuthFlow(AuthFlowException e) {
        AuthError error = e.getError();
        log.debug("auth flow rejected: {} ({})", error, e.getMessage());
        return ResponseEntity.status(error.status()).body(err(error.name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        var fields = ex.getBindingResult().getFieldErrors();
        String msg = fields.isEmpty()
                ? AuthError.VALIDATION_FAILED.defaultMessage()
                : fields.get(0).getField() + " " + fields.get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(err(AuthError.VALIDATION_FAILED.name(), msg));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(err(AuthError.VALIDATION_FAILED.name(), "Malformed request body"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleRSE(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        String code = switch (status.value()) {
            case 401 -> "UNAUTHORIZED";
            case 403 -> "FORBIDDEN";
            case 404 -> "NOT_FOUND";
            default -> "ERROR";
        };
        return ResponseEntity.status(status).body(err(code, e.getReason()));
    }

    /** Storage or mail outages; the caller gets a generic body, the log gets the detail. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception e, HttpServletRequest req) {
        String rid = RequestIdFilter.getOrCreate(req);
        log.error("RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), e);
        Map<String, Object> body = err("INTERNAL_ERROR", "Unexpected error");
        body.put("requestId", rid);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
