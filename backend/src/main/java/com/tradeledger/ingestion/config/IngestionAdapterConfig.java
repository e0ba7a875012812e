package com.tradeledger.ingestion.config;

import com.tradeledger.ingestion.adapter.hyperliquid.HyperliquidInfoClient;
import com.tradeledger.ingestion.adapter.hyperliquid.WebClientHyperliquidInfoClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Wires the Hyperliquid info client and its request limiter from tradeledger.hyperliquid.
 */
@Configuration
@EnableConfigurationProperties(HyperliquidProperties.class)
public class IngestionAdapterConfig {

    @Bean
    public HyperliquidInfoClient hyperliquidInfoClient(WebClient.Builder webClientBuilder, HyperliquidProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(Math.max(1, properties.getResponseTimeoutSeconds())));
        return new WebClientHyperliquidInfoClient(
                webClientBuilder.clientConnector(new ReactorClientHttpConnector(httpClient)),
                properties.getInfoUrl());
    }

    @Bean(name = "hyperliquidRateLimiter")
    public RateLimiter hyperliquidRateLimiter(HyperliquidProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("hyperliquid-info", config);
    }
}
