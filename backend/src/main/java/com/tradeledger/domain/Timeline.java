package com.tradeledger.domain;

import java.time.Instant;
import java.util.List;

/**
 * Time-ordered account activity for one wallet. fromTimestamp/toTimestamp are null when there are no events.
 * Built per request, never persisted.
 */
public record Timeline(
        String wallet,
        List<TimelineEvent> events,
        Instant fromTimestamp,
        Instant toTimestamp
) {

    public Timeline {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static Timeline empty(String wallet) {
        return new Timeline(wallet, List.of(), null, null);
    }
}
