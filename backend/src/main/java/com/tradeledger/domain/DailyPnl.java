package com.tradeledger.domain;

import java.math.BigDecimal;

/**
 * Net PnL of one UTC calendar day (date is YYYY-MM-DD) and the running total up to and including it.
 */
public record DailyPnl(String date, BigDecimal pnl, BigDecimal cumulativePnl) {
}
