package com.tradeledger.ingestion.adapter.hyperliquid;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Transport for the Hyperliquid info endpoint. Separated from pagination for testing.
 */
public interface HyperliquidInfoClient {

    /**
     * POST the payload as JSON to the info endpoint.
     *
     * @param payload request body, e.g. {"type": "userFills", "user": "0x..."}
     * @return response body as string (JSON); errors with UpstreamApiException on HTTP or transport failure
     */
    Mono<String> post(Map<String, Object> payload);
}
