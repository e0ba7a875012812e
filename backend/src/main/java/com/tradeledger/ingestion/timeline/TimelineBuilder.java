package com.tradeledger.ingestion.timeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.domain.Timeline;
import com.tradeledger.domain.TimelineEvent;
import com.tradeledger.ingestion.normalizer.TimelineEventNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges normalized fills and funding payments into one timeline sorted by timestamp ascending.
 * The sort is stable: events sharing a timestamp keep input order (fills before funding).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimelineBuilder {

    private final TimelineEventNormalizer normalizer;

    /**
     * Never fails: malformed records are skipped, null lists are treated as empty.
     */
    public Timeline build(String wallet, List<JsonNode> rawFills, List<JsonNode> rawFunding) {
        List<JsonNode> fills = rawFills != null ? rawFills : List.of();
        List<JsonNode> funding = rawFunding != null ? rawFunding : List.of();

        List<TimelineEvent> events = new ArrayList<>(fills.size() + funding.size());
        for (JsonNode fill : fills) {
            normalizer.normalizeFill(fill).ifPresent(events::add);
        }
        for (JsonNode payment : funding) {
            normalizer.normalizeFunding(payment).ifPresent(events::add);
        }
        events.sort(Comparator.comparing(TimelineEvent::timestamp));

        log.debug("Timeline for {}: kept {} of {} records", wallet, events.size(), fills.size() + funding.size());
        if (events.isEmpty()) {
            return Timeline.empty(wallet);
        }
        return new Timeline(
                wallet,
                events,
                events.get(0).timestamp(),
                events.get(events.size() - 1).timestamp());
    }
}
