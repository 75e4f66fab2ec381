package com.fintech.marketdata.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8000/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8000/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketDataSourceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Data Source Service API")
                        .description("""
                                Cached access to daily financial and macroeconomic time series.
                                
                                **Features:**
                                - Equity history (Yahoo Finance) and FRED macro series behind one endpoint
                                - Upstream fetch only when the cache does not cover the requested range
                                - Per-series serialized fetch and merge, full parallelism across series
                                - Gzipped CSV backup of each merged series to blob storage
                                
                                **Tech Stack:**
                                - Spring Boot 3.2
                                - Resilience4j circuit breakers around upstream calls
                                - LMAX Disruptor backup pipeline
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8000")
                                .description("Local Development Server")
                ));
    }
}
