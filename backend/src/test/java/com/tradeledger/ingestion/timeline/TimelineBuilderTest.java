package com.tradeledger.ingestion.timeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.domain.FillEvent;
import com.tradeledger.domain.FundingEvent;
import com.tradeledger.domain.Timeline;
import com.tradeledger.domain.TimelineEvent;
import com.tradeledger.domain.TimelineEventType;
import com.tradeledger.ingestion.normalizer.TimelineEventNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineBuilderTest {

    private static final String WALLET = "0x742d35cc6634c0532925a3b844bc454e4438f44e";

    private final ObjectMapper mapper = new ObjectMapper();
    private final TimelineBuilder builder = new TimelineBuilder(new TimelineEventNormalizer());

    @Test
    @DisplayName("fills and funding are merged in timestamp order with span")
    void mergesAndSorts() throws Exception {
        List<JsonNode> fills = List.of(
                json("{\"time\": 1000, \"coin\": \"BTC\", \"side\": \"buy\", \"sz\": \"1.0\", \"px\": \"50000\", \"fee\": \"5\", \"closedPnl\": null}"),
                json("{\"time\": 2000, \"coin\": \"BTC\", \"side\": \"sell\", \"sz\": \"1.0\", \"px\": \"51000\", \"fee\": \"5\", \"closedPnl\": \"1000\"}"));
        List<JsonNode> funding = List.of(
                json("{\"time\": 1500, \"coin\": \"BTC\", \"usdc\": \"-2.5\", \"fundingRate\": \"0.0001\"}"));

        Timeline timeline = builder.build(WALLET, fills, funding);

        assertThat(timeline.wallet()).isEqualTo(WALLET);
        assertThat(timeline.events()).extracting(TimelineEvent::type)
                .containsExactly(TimelineEventType.FILL, TimelineEventType.FUNDING, TimelineEventType.FILL);
        assertThat(timeline.events()).extracting(e -> e.timestamp().toEpochMilli())
                .containsExactly(1000L, 1500L, 2000L);
        assertThat(timeline.fromTimestamp()).isEqualTo(Instant.ofEpochMilli(1000));
        assertThat(timeline.toTimestamp()).isEqualTo(Instant.ofEpochMilli(2000));
    }

    @Test
    @DisplayName("malformed fill is dropped while sibling records survive")
    void dropsOnlyMalformedRecords() throws Exception {
        List<JsonNode> fills = List.of(
                json("{\"time\": 1000, \"coin\": \"BTC\", \"side\": \"buy\", \"px\": \"50000\"}"),
                json("{\"time\": 1100, \"coin\": \"BTC\", \"side\": \"buy\", \"sz\": \"notanumber\", \"px\": \"50000\"}"),
                json("{\"time\": 1200, \"coin\": \"ETH\", \"side\": \"buy\", \"sz\": \"2\", \"px\": \"3000\"}"));
        List<JsonNode> funding = List.of(
                json("{\"time\": 900, \"coin\": \"ETH\", \"usdc\": \"0.5\"}"));

        Timeline timeline = builder.build(WALLET, fills, funding);

        assertThat(timeline.events()).hasSize(2);
        assertThat(timeline.events().get(0)).isInstanceOf(FundingEvent.class);
        assertThat(((FillEvent) timeline.events().get(1)).coin()).isEqualTo("ETH");
        assertThat(timeline.fromTimestamp()).isEqualTo(Instant.ofEpochMilli(900));
    }

    @Test
    @DisplayName("events sharing a timestamp keep input order")
    void stableOnTies() throws Exception {
        List<JsonNode> fills = List.of(
                json("{\"time\": 5000, \"coin\": \"A\", \"side\": \"buy\", \"sz\": \"1\", \"px\": \"1\"}"),
                json("{\"time\": 5000, \"coin\": \"B\", \"side\": \"buy\", \"sz\": \"1\", \"px\": \"1\"}"));
        List<JsonNode> funding = List.of(
                json("{\"time\": 5000, \"coin\": \"C\", \"usdc\": \"1\"}"),
                json("{\"time\": 4000, \"coin\": \"D\", \"usdc\": \"1\"}"));

        Timeline timeline = builder.build(WALLET, fills, funding);

        assertThat(timeline.events()).extracting(TimelineBuilderTest::coinOf)
                .containsExactly("D", "A", "B", "C");
    }

    @Test
    @DisplayName("timeline events are non-decreasing for unordered input")
    void nonDecreasingOrder() throws Exception {
        List<JsonNode> fills = new ArrayList<>();
        long[] times = {9_000, 3_000, 7_000, 1_000, 8_000, 2_000};
        for (long t : times) {
            fills.add(json("{\"time\": " + t + ", \"coin\": \"BTC\", \"side\": \"buy\", \"sz\": \"1\", \"px\": \"1\"}"));
        }
        List<JsonNode> funding = List.of(
                json("{\"time\": 6000, \"coin\": \"BTC\", \"usdc\": \"1\"}"),
                json("{\"time\": 500, \"coin\": \"BTC\", \"usdc\": \"1\"}"));

        List<TimelineEvent> events = builder.build(WALLET, fills, funding).events();

        assertThat(events).hasSize(8);
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).timestamp()).isAfterOrEqualTo(events.get(i - 1).timestamp());
        }
    }

    @Test
    @DisplayName("empty input yields no events and absent span")
    void emptyInput() {
        Timeline timeline = builder.build(WALLET, List.of(), List.of());

        assertThat(timeline.events()).isEmpty();
        assertThat(timeline.fromTimestamp()).isNull();
        assertThat(timeline.toTimestamp()).isNull();
        assertThat(builder.build(WALLET, null, null).events()).isEmpty();
    }

    private static String coinOf(TimelineEvent event) {
        if (event instanceof FillEvent fill) {
            return fill.coin();
        }
        return ((FundingEvent) event).coin();
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
