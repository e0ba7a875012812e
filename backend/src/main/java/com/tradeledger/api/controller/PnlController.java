package com.tradeledger.api.controller;

import com.tradeledger.api.dto.LedgerQuery;
import com.tradeledger.domain.DailyPnl;
import com.tradeledger.domain.PnlSummary;
import com.tradeledger.ledger.LedgerQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * GET /pnl (summary with per-asset breakdown) and GET /pnl/daily (daily series with cumulative PnL).
 */
@RestController
@RequestMapping("/api/v1/pnl")
@RequiredArgsConstructor
public class PnlController {

    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public Mono<ResponseEntity<PnlSummary>> getSummary(@Valid LedgerQuery query) {
        return ledgerQueryService.summary(query.wallet().trim(), query.since())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/daily")
    public Mono<ResponseEntity<List<DailyPnl>>> getDaily(@Valid LedgerQuery query) {
        return ledgerQueryService.daily(query.wallet().trim(), query.since())
                .map(ResponseEntity::ok);
    }
}
