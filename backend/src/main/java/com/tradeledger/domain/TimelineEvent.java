package com.tradeledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * One entry of an account timeline. Immutable; the timestamp is used both for ordering and for
 * daily bucketing. Serialized with an {@code event_type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FillEvent.class, name = "fill"),
        @JsonSubTypes.Type(value = FundingEvent.class, name = "funding"),
        @JsonSubTypes.Type(value = LiquidationEvent.class, name = "liquidation"),
        @JsonSubTypes.Type(value = DepositEvent.class, name = "deposit"),
        @JsonSubTypes.Type(value = WithdrawalEvent.class, name = "withdrawal")
})
public sealed interface TimelineEvent
        permits FillEvent, FundingEvent, LiquidationEvent, DepositEvent, WithdrawalEvent {

    Instant timestamp();

    @JsonIgnore
    TimelineEventType type();
}
