package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.exception.AgentNotFoundException;
import com.autonomous.orchestrator.exception.OrchestratorException;
import com.autonomous.orchestrator.exception.QueueFullException;
import com.autonomous.orchestrator.exception.TaskNotFoundException;
import com.autonomous.orchestrator.exception.TaskValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps engine exceptions to HTTP responses with a {@code {code, message}} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<Map<String, String>> handleOrchestratorException(OrchestratorException ex,
                                                                           HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage() == null ? "Malformed request" : ex.getMessage(), 300);
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("INTERNAL_ERROR", "Internal error"));
    }

    static HttpStatus statusFor(OrchestratorException ex) {
        if (ex instanceof TaskValidationException || ex instanceof AgentNotFoundException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof TaskNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof QueueFullException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, String> body(String code, String message) {
        return Map.of("code", code, "message", message == null ? "" : message);
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
