package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Forced close of a position. loss is a positive magnitude; it counts negatively in daily PnL.
 */
public record LiquidationEvent(
        Instant timestamp,
        String coin,
        BigDecimal size,
        BigDecimal price,
        BigDecimal loss
) implements TimelineEvent {

    public LiquidationEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(loss, "loss");
    }

    @Override
    public TimelineEventType type() {
        return TimelineEventType.LIQUIDATION;
    }
}
