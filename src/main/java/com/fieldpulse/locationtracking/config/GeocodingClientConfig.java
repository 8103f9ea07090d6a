package com.fieldpulse.locationtracking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class GeocodingClientConfig {

    // Connect and read timeouts both bounded by tracking.geocoding.timeout-ms
    @Bean("geocodingRestTemplate")
    public RestTemplate geocodingRestTemplate(RestTemplateBuilder builder,
                                              @Value("${tracking.geocoding.timeout-ms:5000}") long timeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }
}
