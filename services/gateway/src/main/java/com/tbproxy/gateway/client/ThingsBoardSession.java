package com.tbproxy.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tbproxy.common.util.JsonUtil;
import com.tbproxy.gateway.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a ThingsBoard JWT pair in memory.
 *
 * The access token is renewed 30 seconds before its {@code exp} claim, with the
 * refresh token when one is held and by a full login otherwise or when the
 * refresh is refused. Concurrent callers that find the token stale share a
 * single renewal.
 */
@Slf4j
public class ThingsBoardSession {

    static final Duration REFRESH_GUARD = Duration.ofSeconds(30);
    static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(150);

    private final WebClient webClient;
    private final String username;
    private final String password;
    private final Duration timeout;
    private final Clock clock;

    private final AtomicReference<Tokens> tokens = new AtomicReference<>();
    private final AtomicReference<Mono<String>> renewal = new AtomicReference<>();

    public ThingsBoardSession(WebClient webClient, String username, String password, Duration timeout, Clock clock) {
        this.webClient = webClient;
        this.username = username;
        this.password = password;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * A currently valid access token, renewing it first if needed.
     */
    public Mono<String> accessToken() {
        return Mono.defer(() -> {
            Tokens current = tokens.get();
            if (current != null && clock.instant().plus(REFRESH_GUARD).isBefore(current.expiresAt())) {
                return Mono.just(current.accessToken());
            }
            return renew();
        });
    }

    /**
     * Drops the held tokens so the next call logs in again. Used after the
     * platform rejected a token that looked valid locally.
     */
    public void invalidate() {
        tokens.set(null);
    }

    private Mono<String> renew() {
        Mono<String> pending = renewal.get();
        if (pending != null) {
            return pending;
        }

        Mono<String> created = obtainTokens().map(Tokens::accessToken).cache();
        if (renewal.compareAndSet(null, created)) {
            return created.doFinally(signal -> renewal.compareAndSet(created, null));
        }
        return renew();
    }

    private Mono<Tokens> obtainTokens() {
        return Mono.defer(() -> {
            Tokens current = tokens.get();
            if (current == null || current.refreshToken() == null) {
                return login();
            }
            return refresh(current.refreshToken())
                    .onErrorResume(error -> {
                        log.warn("ThingsBoard token refresh failed, logging in again: {}", error.getMessage());
                        return login();
                    });
        });
    }

    private Mono<Tokens> login() {
        return webClient.post()
                .uri("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", username, "password", password))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .map(this::store)
                .doOnNext(stored -> log.info("Authenticated against ThingsBoard as {}", username))
                .onErrorMap(error -> !(error instanceof UpstreamException), error -> loginFailure("login", error));
    }

    private Mono<Tokens> refresh(String refreshToken) {
        return webClient.post()
                .uri("/api/auth/token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("refreshToken", refreshToken))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .map(this::store)
                .doOnNext(stored -> log.debug("Refreshed ThingsBoard JWT"))
                .onErrorMap(error -> !(error instanceof UpstreamException), error -> loginFailure("token refresh", error));
    }

    private Tokens store(JsonNode body) {
        String access = body.path("token").asText(null);
        if (access == null || access.isBlank()) {
            throw new UpstreamException(null, "ThingsBoard authentication response has no token");
        }
        String refresh = body.path("refreshToken").asText(null);
        Tokens stored = new Tokens(access, refresh, expiryOf(access));
        tokens.set(stored);
        return stored;
    }

    Instant expiryOf(String jwt) {
        String[] parts = jwt.split("\\.");
        if (parts.length >= 2) {
            try {
                JsonNode claims = JsonUtil.getObjectMapper().readTree(Base64.getUrlDecoder().decode(parts[1]));
                JsonNode exp = claims.get("exp");
                if (exp != null && exp.canConvertToLong()) {
                    return Instant.ofEpochSecond(exp.asLong());
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Could not decode 'exp' from ThingsBoard JWT: {}", e.getMessage());
            }
        }
        log.warn("ThingsBoard JWT has no usable 'exp', assuming {} minutes", DEFAULT_LIFETIME.toMinutes());
        return clock.instant().plus(DEFAULT_LIFETIME);
    }

    private UpstreamException loginFailure(String step, Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return new UpstreamException(response.getStatusCode().value(),
                    "ThingsBoard " + step + " failed with status " + response.getStatusCode().value(), error);
        }
        return new UpstreamException(null, "ThingsBoard " + step + " failed: " + error.getMessage(), error);
    }

    private record Tokens(String accessToken, String refreshToken, Instant expiresAt) {

        @Override
        public String toString() {
            return "Tokens[expiresAt=" + expiresAt + "]";
        }
    }
}
