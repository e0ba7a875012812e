package com.tradeledger.ingestion.adapter.hyperliquid;

import com.tradeledger.ingestion.adapter.UpstreamApiException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hyperliquid info client using WebClient. Used by HyperliquidDataSource.
 */
public class WebClientHyperliquidInfoClient implements HyperliquidInfoClient {

    private final WebClient webClient;
    private final String infoUrl;

    public WebClientHyperliquidInfoClient(WebClient.Builder builder, String infoUrl) {
        this.webClient = builder.build();
        this.infoUrl = infoUrl;
    }

    @Override
    public Mono<String> post(Map<String, Object> payload) {
        return webClient.post()
                .uri(infoUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new UpstreamApiException(
                        "Hyperliquid request failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e))
                .onErrorMap(WebClientRequestException.class, e -> new UpstreamApiException(
                        "Hyperliquid request failed: " + e.getMessage(), e));
    }
}
