package com.tradeledger.api.controller;

import com.tradeledger.api.dto.LedgerQuery;
import com.tradeledger.domain.Timeline;
import com.tradeledger.ledger.LedgerQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GET /timeline: fills and funding merged into one time-ordered event list.
 */
@RestController
@RequestMapping("/api/v1/timeline")
@RequiredArgsConstructor
public class TimelineController {

    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public Mono<ResponseEntity<Timeline>> getTimeline(@Valid LedgerQuery query) {
        return ledgerQueryService.timeline(query.wallet().trim(), query.since())
                .map(ResponseEntity::ok);
    }
}
