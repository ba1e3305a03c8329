package com.vedicchart.engine.exception;

import com.vedicchart.common.exception.CatalogLookupException;
import com.vedicchart.engine.model.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.Locale;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CatalogLookupException.class)
    public ResponseEntity<ApiError> handleCatalogLookup(CatalogLookupException ex, ServerWebExchange exchange) {
        log.warn("Unknown {} identifier: {}", ex.getCatalog(), ex.getIdentifier());
        return build(HttpStatus.BAD_REQUEST, "UNKNOWN_" + ex.getCatalog().toUpperCase(Locale.ROOT), ex.getMessage(), exchange);
    }

    @ExceptionHandler(InvalidChartRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidChartRequestException ex, ServerWebExchange exchange) {
        log.warn("Rejected chart request. field={} reason={}", ex.getField(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleUnreadable(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Malformed request body: {}", ex.getReason());
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body", exchange);
    }

    @ExceptionHandler(EphemerisException.class)
    public ResponseEntity<ApiError> handleEphemeris(EphemerisException ex, ServerWebExchange exchange) {
        log.error("Ephemeris failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, "EPHEMERIS_UNAVAILABLE", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        String reason = ex.getReason() != null ? ex.getReason() : status.toString();
        return build(status, "HTTP_" + status.value(), reason, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", exchange);
    }

    private static ResponseEntity<ApiError> build(HttpStatusCode status, String code, String message,
                                                  ServerWebExchange exchange) {
        ApiError body = ApiError.of(code, message, exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
