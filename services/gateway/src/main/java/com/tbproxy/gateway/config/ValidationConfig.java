package com.tbproxy.gateway.config;

import com.tbproxy.common.dto.telemetry.TelemetryPayloadReader;
import jakarta.validation.Validator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Telemetry validation backed by the Boot-managed bean validator.
 */
@Configuration
public class ValidationConfig {

    @Bean
    public TelemetryPayloadReader telemetryPayloadReader(Validator validator) {
        return new TelemetryPayloadReader(validator);
    }
}
