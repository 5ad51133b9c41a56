package com.procureagent.common.web;

import com.procureagent.common.exception.DuplicateSessionException;
import com.procureagent.common.exception.EmptyInputException;
import com.procureagent.common.exception.ExternalServiceException;
import com.procureagent.common.exception.InvalidConfigurationException;
import com.procureagent.common.exception.InvalidOfferException;
import com.procureagent.common.exception.NoValidOffersException;
import com.procureagent.common.exception.SessionClosedException;
import com.procureagent.common.exception.SessionNotFoundException;
import com.procureagent.common.exception.UnknownVendorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Maps the engine's exception taxonomy to HTTP status codes for the reactive controllers.
 * Services pull it in with {@code @Import(ApiExceptionHandler.class)}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
        InvalidConfigurationException.class,
        InvalidOfferException.class,
        NoValidOffersException.class,
        EmptyInputException.class,
        ServerWebInputException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, ex, exchange);
    }

    @ExceptionHandler({SessionNotFoundException.class, UnknownVendorException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception ex, ServerWebExchange exchange) {
        return respond(HttpStatus.NOT_FOUND, ex, exchange);
    }

    @ExceptionHandler({
        DuplicateSessionException.class,
        SessionClosedException.class,
        IllegalStateException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(Exception ex, ServerWebExchange exchange) {
        return respond(HttpStatus.CONFLICT, ex, exchange);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternal(ExternalServiceException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_GATEWAY, ex, exchange);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception ex, ServerWebExchange exchange) {
        String path = exchange == null ? "-" : exchange.getRequest().getPath().value();
        log.warn("HTTP_ERROR path={} status={} errorType={} errorMessage={}",
                 path, status.value(), ex.getClass().getSimpleName(), ex.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(ex.getClass().getSimpleName(), ex.getMessage(), path, Instant.now()));
    }
}
