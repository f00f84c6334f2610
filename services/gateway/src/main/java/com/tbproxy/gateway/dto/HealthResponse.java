package com.tbproxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("timestamp")
    long timestamp,

    @JsonProperty("service")
    String service,

    @JsonProperty("version")
    String version
) {
}
