package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record DepositEvent(Instant timestamp, BigDecimal amount, String token) implements TimelineEvent {

    public DepositEvent {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public TimelineEventType type() {
        return TimelineEventType.DEPOSIT;
    }
}
