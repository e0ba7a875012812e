package com.tradeledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Read-only API: GET from any configured origin, Content-Type header only.
 */
@Configuration
public class CorsConfig implements WebFluxConfigurer {

    @Value("${tradeledger.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods(HttpMethod.GET.name())
                .allowedHeaders(HttpHeaders.CONTENT_TYPE);
    }
}
