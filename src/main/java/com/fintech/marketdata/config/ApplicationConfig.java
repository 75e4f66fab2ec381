package com.fintech.marketdata.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    /**
     * HTTP client shared by the upstream fetchers. Yahoo Finance rejects requests
     * without a browser-like User-Agent.
     */
    @Bean
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder, MarketDataProperties properties) {
        MarketDataProperties.Upstream upstream = properties.getUpstream();
        return builder
            .setConnectTimeout(upstream.getConnectTimeout())
            .setReadTimeout(upstream.getReadTimeout())
            .defaultHeader(HttpHeaders.USER_AGENT, upstream.getUserAgent())
            .build();
    }
}
