package com.tradeledger.ingestion.adapter.hyperliquid;

import com.tradeledger.ingestion.adapter.UpstreamApiException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientHyperliquidInfoClientTest {

    private static final String INFO_URL = "https://hyperliquid.test/info";

    @Test
    @DisplayName("POSTs JSON to the info URL and returns the body")
    void postsJson() {
        List<ClientRequest> requests = new ArrayList<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                    .body("[{\"time\": 1}]")
                    .build());
        });
        WebClientHyperliquidInfoClient client = new WebClientHyperliquidInfoClient(builder, INFO_URL);

        StepVerifier.create(client.post(Map.of("type", "allMids")))
                .expectNext("[{\"time\": 1}]")
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(INFO_URL);
        assertThat(requests.get(0).headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    @DisplayName("non-2xx status maps to UpstreamApiException with status and body")
    void errorStatus() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request ->
                Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR)
                        .header("Content-Type", MediaType.TEXT_PLAIN_VALUE)
                        .body("upstream down")
                        .build()));
        WebClientHyperliquidInfoClient client = new WebClientHyperliquidInfoClient(builder, INFO_URL);

        StepVerifier.create(client.post(Map.of("type", "userFills", "user", "0xabc")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamApiException.class)
                        .hasMessageContaining("500")
                        .hasMessageContaining("upstream down"))
                .verify();
    }
}
