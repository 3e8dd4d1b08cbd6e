package dev.rocketblog.exception;

import dev.rocketblog.config.RequestIdFilter;
import dev.rocketblog.dto.ErrorResponse;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcTimeoutException;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Translates every failure into the error envelope. Client errors are logged at WARN,
 * server errors at ERROR. Log lines carry the request id, the request path and the
 * failure kind but never the raw query string. Store failures also log the query
 * intent (operation, sort and window) recorded for the request. Store messages are never sent to the client.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final List<Locale> SUPPORTED_LOCALES = List.of(Locale.ENGLISH);

    private final MessageSource messageSource;

    @ExceptionHandler(InvalidRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidRequest(InvalidRequestException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        String message = msg(locale, ex.getMessage());
        log.warn("[{}] Invalid request parameter '{}' on {}", requestId(exchange), ex.getField(), path(exchange));
        return Mono.just(build(HttpStatus.BAD_REQUEST, message, exchange,
                Map.of(ex.getField(), message)));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String propertyPath = violation.getPropertyPath().toString();
            String field = propertyPath.contains(".")
                    ? propertyPath.substring(propertyPath.lastIndexOf('.') + 1)
                    : propertyPath;
            errors.put(field, violation.getMessage());
        });

        log.warn("[{}] Constraint violations on {}: {}", requestId(exchange), path(exchange), errors.keySet());
        return Mono.just(build(HttpStatus.BAD_REQUEST,
                msg(resolveLocale(exchange), "error.invalid_request_params"), exchange, errors));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex, ServerWebExchange exchange) {
        log.warn("[{}] Parameter validation failed on {}", requestId(exchange), path(exchange));
        return Mono.just(build(HttpStatus.BAD_REQUEST,
                msg(resolveLocale(exchange), "error.invalid_request_params"), exchange, null));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("[{}] Bad request input on {}: {}", requestId(exchange), path(exchange), ex.getReason());
        return Mono.just(build(HttpStatus.BAD_REQUEST,
                msg(resolveLocale(exchange), "error.invalid_request"), exchange, null));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("[{}] Resource not found on {}", requestId(exchange), path(exchange));
        return Mono.just(build(HttpStatus.NOT_FOUND,
                msg(resolveLocale(exchange), "error.not_found"), exchange, null));
    }

    /**
     * No pooled connection within the acquire bound, or the statement ran past its deadline.
     */
    @ExceptionHandler({
            DataAccessResourceFailureException.class,
            QueryTimeoutException.class,
            R2dbcTimeoutException.class,
            TimeoutException.class
    })
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleStoreUnavailable(Exception ex, ServerWebExchange exchange) {
        log.error("[{}] Store unavailable while serving {} ({}): {}", requestId(exchange), path(exchange),
                queryIntent(exchange), ex.getClass().getSimpleName(), ex);
        return Mono.just(build(HttpStatus.SERVICE_UNAVAILABLE,
                msg(resolveLocale(exchange), "error.service_unavailable"), exchange, null));
    }

    @ExceptionHandler({DataAccessException.class, R2dbcException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleStoreError(Exception ex, ServerWebExchange exchange) {
        log.error("[{}] Store query failed while serving {} ({}): {}", requestId(exchange), path(exchange),
                queryIntent(exchange), ex.getClass().getSimpleName(), ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR,
                msg(resolveLocale(exchange), "error.internal_server_error"), exchange, null));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("[{}] Response status exception on {}: {}", requestId(exchange), path(exchange), status);
        String message = msg(resolveLocale(exchange), statusToKey(status));
        return Mono.just(ResponseEntity.status(status).body(build(status, message, exchange, null)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("[{}] Unexpected error while serving {}", requestId(exchange), path(exchange), ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR,
                msg(resolveLocale(exchange), "error.unexpected_error"), exchange, null));
    }

    private ErrorResponse build(HttpStatus status, String message, ServerWebExchange exchange,
                                Map<String, String> validationErrors) {
        return ErrorResponse.builder()
                .error(message)
                .status(status.value())
                .path(path(exchange))
                .validationErrors(validationErrors)
                .build();
    }

    private String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }

    private static String requestId(ServerWebExchange exchange) {
        return RequestIdFilter.currentRequestId(exchange);
    }

    private static String queryIntent(ServerWebExchange exchange) {
        return RequestIdFilter.currentQueryIntent(exchange);
    }

    /**
     * Resolve locale from the Accept-Language header.
     */
    private Locale resolveLocale(ServerWebExchange exchange) {
        String acceptLanguage = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ACCEPT_LANGUAGE);
        if (acceptLanguage != null && !acceptLanguage.isBlank()) {
            try {
                Locale matched = Locale.lookup(Locale.LanguageRange.parse(acceptLanguage), SUPPORTED_LOCALES);
                if (matched != null) {
                    return matched;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Accept-Language header");
            }
        }
        return Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case BAD_REQUEST -> "error.bad_request";
            case METHOD_NOT_ALLOWED -> "error.method_not_allowed";
            case SERVICE_UNAVAILABLE -> "error.service_unavailable";
            default -> "error.internal_server_error";
        };
    }
}
