package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Trade fill. realizedPnl and txHash are null when the upstream record did not carry them.
 */
public record FillEvent(
        Instant timestamp,
        String coin,
        String side,
        BigDecimal size,
        BigDecimal price,
        BigDecimal fee,
        BigDecimal realizedPnl,
        String txHash
) implements TimelineEvent {

    public FillEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(coin, "coin");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(price, "price");
        fee = fee != null ? fee : BigDecimal.ZERO;
    }

    @Override
    public TimelineEventType type() {
        return TimelineEventType.FILL;
    }
}
