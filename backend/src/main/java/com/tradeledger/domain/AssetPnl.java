package com.tradeledger.domain;

import java.math.BigDecimal;

/**
 * Per-coin PnL breakdown. netPnl = realizedPnl + fundingPnl - fees.
 */
public record AssetPnl(
        String coin,
        BigDecimal realizedPnl,
        BigDecimal fundingPnl,
        BigDecimal fees,
        BigDecimal netPnl,
        int tradeCount
) {
}
