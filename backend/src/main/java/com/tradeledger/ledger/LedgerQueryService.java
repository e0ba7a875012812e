package com.tradeledger.ledger;

import com.tradeledger.domain.DailyPnl;
import com.tradeledger.domain.PnlSummary;
import com.tradeledger.domain.Timeline;
import com.tradeledger.ingestion.timeline.TimelineBuilder;
import com.tradeledger.ingestion.wallet.WalletHistoryService;
import com.tradeledger.pnl.engine.PnlCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-request pipeline: fetch raw history, build the timeline, aggregate PnL. Nothing is persisted or cached.
 * Fills, funding and state are fetched concurrently; cancelling the returned Mono cancels the upstream calls.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final WalletHistoryService walletHistoryService;
    private final TimelineBuilder timelineBuilder;
    private final PnlCalculator pnlCalculator;

    public Mono<Timeline> timeline(String wallet, Long since) {
        return Mono.zip(
                        walletHistoryService.fetchAllFills(wallet, since),
                        walletHistoryService.fetchAllFunding(wallet, since))
                .map(history -> timelineBuilder.build(wallet, history.getT1(), history.getT2()));
    }

    public Mono<PnlSummary> summary(String wallet, Long since) {
        return Mono.zip(
                        walletHistoryService.fetchAllFills(wallet, since),
                        walletHistoryService.fetchAllFunding(wallet, since),
                        walletHistoryService.fetchUserState(wallet))
                .map(history -> {
                    Timeline timeline = timelineBuilder.build(wallet, history.getT1(), history.getT2());
                    BigDecimal unrealized = pnlCalculator.calculateUnrealizedFromState(history.getT3());
                    return pnlCalculator.calculateSummary(wallet, timeline, unrealized);
                });
    }

    public Mono<List<DailyPnl>> daily(String wallet, Long since) {
        return timeline(wallet, since).map(pnlCalculator::calculateDaily);
    }
}
