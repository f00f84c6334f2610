package com.tbproxy.gateway.config;

import com.tbproxy.gateway.client.ThingsBoardSession;
import com.tbproxy.gateway.client.ThingsBoardTelemetryClient;
import com.tbproxy.gateway.client.UpstreamTelemetryClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * ThingsBoard connection settings.
 */
@Configuration
@Slf4j
public class UpstreamConfig {

    @Value("${app.upstream.base-url:http://localhost:8080}")
    private String baseUrl;

    @Value("${app.upstream.username:}")
    private String username;

    @Value("${app.upstream.password:}")
    private String password;

    @Value("${app.upstream.timeout:10s}")
    private Duration timeout;

    @Bean
    public WebClient thingsBoardWebClient(WebClient.Builder builder) {
        if (!baseUrl.startsWith("https://")) {
            log.warn("ThingsBoard base URL {} is not HTTPS", baseUrl);
        }
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public ThingsBoardSession thingsBoardSession(WebClient thingsBoardWebClient, Clock clock) {
        return new ThingsBoardSession(thingsBoardWebClient, username, password, timeout, clock);
    }

    @Bean
    public UpstreamTelemetryClient upstreamTelemetryClient(
            WebClient thingsBoardWebClient,
            ThingsBoardSession thingsBoardSession,
            MeterRegistry meterRegistry) {
        return new ThingsBoardTelemetryClient(thingsBoardWebClient, thingsBoardSession, timeout, meterRegistry);
    }
}
