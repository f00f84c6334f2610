package com.tbproxy.gateway.filter;

import com.tbproxy.common.error.ErrorNormalizer;
import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.NormalizedError;
import com.tbproxy.common.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Writes a normalized error body from a web filter, where controller advice
 * does not apply.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ErrorNormalizer errorNormalizer;

    public Mono<Void> write(ServerWebExchange exchange, FailureCause failure) {
        NormalizedError error = errorNormalizer.normalize(failure, exchange.getRequest().getPath().value());

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.valueOf(error.status()));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        DataBuffer buffer = response.bufferFactory().wrap(JsonUtil.toJsonBytes(error));
        return response.writeWith(Mono.just(buffer));
    }
}
