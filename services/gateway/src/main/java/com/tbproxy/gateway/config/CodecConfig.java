package com.tbproxy.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tbproxy.common.util.JsonUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.CodecConfigurer;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Inbound bodies, ThingsBoard calls and filter-written errors all go through
 * the mapper from {@link JsonUtil}, so telemetry timestamps bind the same way
 * everywhere. Inbound JSON is buffered up to {@code app.max-body-size} so that
 * large bulk uploads fit.
 */
@Configuration
public class CodecConfig implements WebFluxConfigurer {

    @Value("${app.max-body-size:4MB}")
    private DataSize maxBodySize;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        configurer.defaultCodecs().maxInMemorySize(maxBodyBytes());
        useSharedMapper(configurer, maxBodyBytes());
    }

    @Bean
    public WebClientCustomizer thingsBoardCodecCustomizer() {
        return builder -> builder.codecs(configurer -> useSharedMapper(configurer, null));
    }

    int maxBodyBytes() {
        return Math.toIntExact(maxBodySize.toBytes());
    }

    private void useSharedMapper(CodecConfigurer configurer, Integer maxInMemorySize) {
        ObjectMapper mapper = objectMapper();
        Jackson2JsonDecoder decoder = new Jackson2JsonDecoder(mapper);
        if (maxInMemorySize != null) {
            decoder.setMaxInMemorySize(maxInMemorySize);
        }
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(decoder);
    }
}
