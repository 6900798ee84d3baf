package me.golemcore.assistant.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.assistant.domain.model.AgentException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps exceptions of the chat API to {@link ApiErrorResponse} bodies.
 */
@ControllerAdvice(basePackages = "me.golemcore.assistant.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AgentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAgent(AgentException ex) {
        HttpStatus status = switch (ex.getKind()) {
        case NO_PROVIDER -> HttpStatus.SERVICE_UNAVAILABLE;
        case MAX_ITERATIONS_REACHED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        log.warn("[API] Agent run failed ({}): {}", ex.getKind(), ex.getMessage());
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

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
