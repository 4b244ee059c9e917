package com.architecture.flowlayout.controller;

import com.architecture.flowlayout.dto.ErrorResponse;
import com.architecture.flowlayout.exception.FlowReferenceException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps layout failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(FlowReferenceException.class)
    public ResponseEntity<ErrorResponse> handleFlowReference(FlowReferenceException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, transitionId={}, missingNodeId={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(),
                ex.getTransitionId(), ex.getMissingNodeId());
        ErrorResponse body = ErrorResponse.builder()
                .code("UNRESOLVED_REFERENCE")
                .message(ex.getMessage())
                .transitionId(ex.getTransitionId())
                .missingNodeId(ex.getMissingNodeId())
                .build();
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(ex.getMessage() != null ? ex.getMessage() : "Malformed request");
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(), message);
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("BAD_REQUEST")
                .message(message)
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(),
                truncate(ex.getMessage()), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .code("INTERNAL_ERROR")
                .message("Layout failed: " + ex.getClass().getSimpleName())
                .build());
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null || request.getRequestURI() == null ? "-" : request.getRequestURI();
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null || request.getMethod() == null ? "-" : request.getMethod();
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
