package com.tradeledger.ingestion.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.common.JsonFields;
import com.tradeledger.domain.FillEvent;
import com.tradeledger.domain.FundingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Converts raw Hyperliquid fill and funding records into timeline events.
 * A record missing a required field (or carrying one that does not parse) yields no event;
 * optional fields fall back to zero or empty.
 */
@Component
@Slf4j
public class TimelineEventNormalizer {

    /**
     * Required: time (epoch ms), coin (non-empty), side, sz, px (decimal strings).
     * Optional: fee (defaults to zero), closedPnl, hash.
     */
    public Optional<FillEvent> normalizeFill(JsonNode raw) {
        Optional<Instant> timestamp = JsonFields.epochMillis(raw, "time");
        Optional<String> coin = JsonFields.text(raw, "coin").filter(c -> !c.isEmpty());
        Optional<String> side = JsonFields.text(raw, "side");
        Optional<BigDecimal> size = JsonFields.decimal(raw, "sz");
        Optional<BigDecimal> price = JsonFields.decimal(raw, "px");
        if (timestamp.isEmpty() || coin.isEmpty() || side.isEmpty() || size.isEmpty() || price.isEmpty()) {
            log.debug("Dropping malformed fill record: {}", raw);
            return Optional.empty();
        }
        return Optional.of(new FillEvent(
                timestamp.get(),
                coin.get(),
                side.get(),
                size.get(),
                price.get(),
                JsonFields.decimal(raw, "fee").orElse(BigDecimal.ZERO),
                JsonFields.decimal(raw, "closedPnl").orElse(null),
                JsonFields.text(raw, "hash").orElse(null)));
    }

    /**
     * Required: time (epoch ms), coin, usdc (decimal string). Optional: fundingRate (defaults to zero).
     * userFunding nests the payment under "delta"; flat records are read as-is.
     */
    public Optional<FundingEvent> normalizeFunding(JsonNode raw) {
        JsonNode payment = paymentNode(raw);
        Optional<Instant> timestamp = JsonFields.epochMillis(raw, "time");
        Optional<String> coin = JsonFields.text(payment, "coin").filter(c -> !c.isEmpty());
        Optional<BigDecimal> amount = JsonFields.decimal(payment, "usdc");
        if (timestamp.isEmpty() || coin.isEmpty() || amount.isEmpty()) {
            log.debug("Dropping malformed funding record: {}", raw);
            return Optional.empty();
        }
        return Optional.of(new FundingEvent(
                timestamp.get(),
                coin.get(),
                amount.get(),
                JsonFields.decimal(payment, "fundingRate").orElse(BigDecimal.ZERO)));
    }

    private static JsonNode paymentNode(JsonNode raw) {
        if (raw == null) {
            return null;
        }
        JsonNode delta = raw.get("delta");
        return delta != null && delta.isObject() ? delta : raw;
    }
}
