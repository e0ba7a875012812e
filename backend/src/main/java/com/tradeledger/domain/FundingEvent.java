package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Funding payment. Positive amount = received, negative = paid. fundingRate is informational only.
 */
public record FundingEvent(
        Instant timestamp,
        String coin,
        BigDecimal amount,
        BigDecimal fundingRate
) implements TimelineEvent {

    public FundingEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(coin, "coin");
        Objects.requireNonNull(amount, "amount");
        fundingRate = fundingRate != null ? fundingRate : BigDecimal.ZERO;
    }

    @Override
    public TimelineEventType type() {
        return TimelineEventType.FUNDING;
    }
}
