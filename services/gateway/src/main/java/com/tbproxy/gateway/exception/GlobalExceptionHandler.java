package com.tbproxy.gateway.exception;

import com.tbproxy.common.error.ErrorCode;
import com.tbproxy.common.error.ErrorNormalizer;
import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.NormalizedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Global exception handler for REST endpoints. Every error leaves the service
 * as a {@link NormalizedError}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorNormalizer errorNormalizer;

    public GlobalExceptionHandler(ErrorNormalizer errorNormalizer) {
        this.errorNormalizer = errorNormalizer;
    }

    /**
     * Handle exceptions raised by the proxy itself (upstream, not found, bad batch).
     */
    @ExceptionHandler(ProxyException.class)
    public Mono<ResponseEntity<NormalizedError>> handleProxyException(
            ProxyException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        if (ex instanceof UpstreamException upstream) {
            log.warn("Upstream failure for {} (status={}): {}", path, upstream.getStatusCode(), ex.getMessage());
        } else {
            log.warn("Request rejected for {}: {}", path, ex.getMessage());
        }
        return respond(ex.failure(), path);
    }

    /**
     * Handle unreadable bodies, JSON parsing errors and bad path variables.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<NormalizedError>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        log.warn("Malformed request for {}: {}", path, ex.getReason());
        return respond(FailureClassifier.classify(ex), path);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<NormalizedError>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        FailureCause failure = FailureClassifier.classify(ex);
        if (failure.code() == ErrorCode.INTERNAL_ERROR) {
            log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);
        } else {
            log.warn("Request failed for {}: {}", path, ex.getMessage());
        }
        return respond(failure, path);
    }

    private Mono<ResponseEntity<NormalizedError>> respond(FailureCause failure, String path) {
        NormalizedError error = errorNormalizer.normalize(failure, path);
        return Mono.just(ResponseEntity.status(error.status()).body(error));
    }
}
