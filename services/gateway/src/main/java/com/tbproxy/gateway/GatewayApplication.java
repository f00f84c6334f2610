package com.tbproxy.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ThingsBoard proxy gateway
 *
 * Accepts telemetry uploads over HTTP, applies API key authentication and
 * per-client rate limiting, and forwards the data to ThingsBoard.
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
