package me.golemcore.careergraph.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.careergraph.domain.exception.GraphErrorKind;
import me.golemcore.careergraph.domain.exception.GraphException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the API controllers. Graph errors map to
 * HTTP status by kind; bodies are {@link ApiErrorResponse}.
 */
@ControllerAdvice(basePackages = "me.golemcore.careergraph.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GraphException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGraph(GraphException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        } else {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        return respond(status, ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name(), ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    static HttpStatus statusOf(GraphErrorKind kind) {
        return switch (kind) {
            case INVALID_TYPE -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SOURCE_INVALID -> HttpStatus.UNPROCESSABLE_ENTITY;
            case GENERATOR_UNAVAILABLE, ENCODER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String kind, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(kind)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
