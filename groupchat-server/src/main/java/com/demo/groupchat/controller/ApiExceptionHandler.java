package com.demo.groupchat.controller;

import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Maps domain failures to HTTP responses of the form {"error": CODE, "detail": message}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private final MetricsService metricsService;

    public ApiExceptionHandler(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @ExceptionHandler(ChatServiceException.class)
    public ResponseEntity<Map<String, Object>> handleChatServiceException(ChatServiceException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Upstream failure: {}", e.getMessage(), e);
            metricsService.recordError(e.getCode().name(), "api");
        } else {
            log.debug("Request rejected: code={}, detail={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getCode().name(),
                "detail", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletionException(CompletionException e) {
        Throwable cause = ChatServiceException.unwrap(e);
        if (cause instanceof ChatServiceException chatServiceException) {
            return handleChatServiceException(chatServiceException);
        }
        return handleUnexpected(cause);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        ErrorCode code = e instanceof MissingRequestHeaderException ? ErrorCode.UNAUTHENTICATED : ErrorCode.INVALID_ARGUMENT;
        return ResponseEntity.status(statusOf(code)).body(Map.of(
                "error", code.name(),
                "detail", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Throwable e) {
        log.error("Unhandled error", e);
        metricsService.recordError(e.getClass().getSimpleName(), "api");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "INTERNAL",
                "detail", "Internal server error"));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS, ALREADY_MEMBER, NOT_MEMBER -> HttpStatus.CONFLICT;
            case INVALID_SENDER, NOT_A_MEMBER -> HttpStatus.FORBIDDEN;
            case MISSING_TOKEN -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case UPSTREAM -> HttpStatus.BAD_GATEWAY;
        };
    }
}
