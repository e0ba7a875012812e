package com.tradeledger.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.api.dto.LedgerQuery;
import com.tradeledger.ingestion.wallet.WalletHistoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Raw upstream records as fetched (all pages), without normalization.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class WalletHistoryController {

    private final WalletHistoryService walletHistoryService;

    @GetMapping("/fills")
    public Mono<ResponseEntity<List<JsonNode>>> getFills(@Valid LedgerQuery query) {
        return walletHistoryService.fetchAllFills(query.wallet().trim(), query.since())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/funding")
    public Mono<ResponseEntity<List<JsonNode>>> getFunding(@Valid LedgerQuery query) {
        return walletHistoryService.fetchAllFunding(query.wallet().trim(), query.since())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/mids")
    public Mono<ResponseEntity<JsonNode>> getMids() {
        return walletHistoryService.fetchAllMids()
                .map(ResponseEntity::ok);
    }
}
