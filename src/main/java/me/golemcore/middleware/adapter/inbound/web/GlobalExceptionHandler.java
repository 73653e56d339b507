package me.golemcore.middleware.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.middleware.domain.exception.DuplicateHandlerException;
import me.golemcore.middleware.domain.exception.StorageUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the middleware API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.middleware.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(DuplicateHandlerException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleDuplicateHandler(DuplicateHandlerException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.CONFLICT, ex.getMessage()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.warn("[API] Event storage unavailable: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.SERVICE_UNAVAILABLE, "Event storage unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
