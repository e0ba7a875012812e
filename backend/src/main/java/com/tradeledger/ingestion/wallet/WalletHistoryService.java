package com.tradeledger.ingestion.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.ingestion.adapter.TradingDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches raw wallet history from the configured data source. No caching: every call goes upstream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletHistoryService {

    private final TradingDataSource dataSource;

    public Mono<List<JsonNode>> fetchAllFills(String wallet, Long since) {
        return Mono.defer(() -> {
            log.info("Fetching fills for wallet: {}", wallet);
            return dataSource.getFills(wallet, since);
        }).doOnNext(fills -> log.info("Fetched {} fills for {}", fills.size(), wallet));
    }

    public Mono<List<JsonNode>> fetchAllFunding(String wallet, Long since) {
        return Mono.defer(() -> {
            log.info("Fetching funding for wallet: {}", wallet);
            return dataSource.getFunding(wallet, since);
        }).doOnNext(funding -> log.info("Fetched {} funding payments for {}", funding.size(), wallet));
    }

    public Mono<JsonNode> fetchUserState(String wallet) {
        return dataSource.getUserState(wallet)
                .doOnError(e -> log.warn("User state fetch failed for {}: {}", wallet, e.getMessage()));
    }

    public Mono<JsonNode> fetchAllMids() {
        return dataSource.getAllMids();
    }
}
