package com.tbproxy.gateway.config;

import com.tbproxy.common.error.ErrorNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Error reporting. Debug mode exposes internal messages, with credentials
 * still redacted.
 */
@Configuration
public class ErrorConfig {

    @Value("${app.debug:false}")
    private boolean debug;

    @Value("${app.api-key:}")
    private String apiKey;

    @Value("${app.upstream.password:}")
    private String upstreamPassword;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ErrorNormalizer errorNormalizer(Clock clock) {
        return new ErrorNormalizer(debug, List.of(apiKey, upstreamPassword), clock);
    }
}
