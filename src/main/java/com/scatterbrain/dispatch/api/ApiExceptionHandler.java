package com.scatterbrain.dispatch.api;

import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates plan errors into HTTP responses. The body always names the error kind so that
 * clients, the CLI included, can rebuild the typed error.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_OPERATION -> HttpStatus.BAD_REQUEST;
            case LEASE_REQUIRED -> HttpStatus.PRECONDITION_REQUIRED;
            case LEASE_INVALID, ALREADY_COMPLETED -> HttpStatus.CONFLICT;
            case LOCK_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    @ExceptionHandler(PlanException.class)
    public ResponseEntity<Map<String, String>> handlePlanException(PlanException ex, HttpServletRequest request) {
        log.debug("HTTP_ERROR path={}, method={}, kind={}, message={}",
                request.getRequestURI(), request.getMethod(), ex.kind(), ex.getMessage());
        return ResponseEntity.status(statusOf(ex.kind())).body(body(ex.kind(), ex.getMessage()));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = ex instanceof MethodArgumentTypeMismatchException mismatch && mismatch.getCause() != null
                ? rootMessage(mismatch)
                : ex.getMessage();
        log.debug("HTTP_ERROR path={}, method={}, errorType={}, message={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(body(ErrorKind.INVALID_OPERATION, message));
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private static Map<String, String> body(ErrorKind kind, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("kind", kind.name());
        body.put("error", message != null ? message : kind.name());
        return body;
    }
}
