package com.fieldpulse.locationtracking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document for /api/tracking, grouped the way clients use it:
 * devices post samples, dashboards pull reports, operators run maintenance.
 */
@Configuration
public class SwaggerConfig {

    public static final String TAG_INGESTION = "Ingestion";
    public static final String TAG_REPORTS = "Reports";
    public static final String TAG_MAINTENANCE = "Maintenance";

    @Bean
    public OpenAPI openAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Location Tracking API")
                        .description("GPS sample ingestion with virtual-location, accuracy and per-user rate-limit "
                                + "screening; lazy reverse geocoding; trip, stop and productivity reports per user "
                                + "or for up to 100 users over named timeframes.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FieldPulse Platform")
                                .email("platform@fieldpulse.example")))
                .tags(List.of(
                        new Tag().name(TAG_INGESTION)
                                .description("POST /api/tracking, /batch and /stops: samples that were skipped come back with warnings"),
                        new Tag().name(TAG_REPORTS)
                                .description("Daily, timeframe, custom-range and multi-user trip reports, cached for an hour"),
                        new Tag().name(TAG_MAINTENANCE)
                                .description("Address backfill, day recalculation, soft delete and restore")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
