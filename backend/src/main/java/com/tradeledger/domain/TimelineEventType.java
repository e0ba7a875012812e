package com.tradeledger.domain;

/**
 * Kind of a timeline event. Only FILL and FUNDING are produced by the normalizer today;
 * the others are reserved for upstream record types not ingested yet.
 */
public enum TimelineEventType {
    FILL,
    FUNDING,
    LIQUIDATION,
    DEPOSIT,
    WITHDRAWAL
}
