package com.tradeledger.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of raw account history for a wallet. Implementations paginate internally; callers get
 * fully materialized, time-ascending lists. Errors surface as {@link UpstreamApiException}.
 */
public interface TradingDataSource {

    /**
     * All trade fills from startTime (epoch ms, inclusive) to now; full history when startTime is null.
     */
    Mono<List<JsonNode>> getFills(String wallet, Long startTime);

    /**
     * All funding payments from startTime (epoch ms, inclusive) to now; full history when startTime is null.
     */
    Mono<List<JsonNode>> getFunding(String wallet, Long startTime);

    /**
     * Current account state (open positions with exchange-reported unrealized PnL, margin summary).
     */
    Mono<JsonNode> getUserState(String wallet);

    /**
     * Current mid price per coin.
     */
    Mono<JsonNode> getAllMids();
}
