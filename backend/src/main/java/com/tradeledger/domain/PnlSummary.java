package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * PnL totals for a wallet over the timeline period.
 * totalPnl = realizedPnl + unrealizedPnl; netPnl = totalPnl + fundingPnl - tradingFees.
 * byAsset is ordered by coin symbol.
 */
public record PnlSummary(
        String wallet,
        Instant periodStart,
        Instant periodEnd,
        BigDecimal realizedPnl,
        BigDecimal unrealizedPnl,
        BigDecimal totalPnl,
        BigDecimal fundingPnl,
        BigDecimal tradingFees,
        BigDecimal netPnl,
        Map<String, AssetPnl> byAsset
) {
}
