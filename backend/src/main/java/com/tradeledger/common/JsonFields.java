package com.tradeledger.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Typed reads of semi-structured upstream JSON. Every accessor returns empty instead of throwing
 * when the field is missing or has the wrong shape.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * String value of a textual field. Numbers, booleans and objects are not coerced.
     */
    public static Optional<String> text(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(value.textValue());
    }

    /**
     * Decimal encoded as a JSON string (e.g. "-2.5"). Numeric JSON nodes are rejected.
     */
    public static Optional<BigDecimal> decimal(JsonNode node, String field) {
        return text(node, field).flatMap(JsonFields::parseDecimal);
    }

    /**
     * Integral JSON number that fits in a long.
     */
    public static Optional<Long> longValue(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            return Optional.empty();
        }
        return Optional.of(value.longValue());
    }

    /**
     * Epoch-millisecond field as a UTC instant.
     */
    public static Optional<Instant> epochMillis(JsonNode node, String field) {
        return longValue(node, field).map(Instant::ofEpochMilli);
    }

    public static Optional<BigDecimal> parseDecimal(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
