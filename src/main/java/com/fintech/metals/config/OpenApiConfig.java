package com.fintech.metals.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Swagger UI: http://localhost:8080/swagger-ui/index.html
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metalPriceEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metal Price Engine API")
                        .description("""
                                Metals quote ingestion and session-bounded aggregation.

                                **Features:**
                                - Calendar-gated polling of spot, 3-month, contract-month and supplier feeds
                                - Duplicate suppression within a lookback window at 2 decimal places
                                - Minute-collapsed session aggregates with previous-session fallback
                                - Cached last-good aggregates while the store is unavailable
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
