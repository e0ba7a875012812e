package com.tradeledger.ingestion.adapter.hyperliquid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.tradeledger.common.JsonFields;
import com.tradeledger.ingestion.adapter.TradingDataSource;
import com.tradeledger.ingestion.adapter.UpstreamApiException;
import com.tradeledger.ingestion.config.HyperliquidProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hyperliquid adapter: userFills / userFunding paginated by startTime, clearinghouseState and allMids as single calls.
 * A page shorter than the page size is the last one; otherwise the next page starts at the last record's time + 1.
 * Every call passes through the shared hyperliquid rate limiter.
 */
@Slf4j
@Component
public class HyperliquidDataSource implements TradingDataSource {

    static final String USER_FILLS = "userFills";
    static final String USER_FUNDING = "userFunding";
    static final String CLEARINGHOUSE_STATE = "clearinghouseState";
    static final String ALL_MIDS = "allMids";

    private final HyperliquidInfoClient infoClient;
    private final RateLimiter rateLimiter;
    private final HyperliquidProperties properties;
    private final ObjectMapper objectMapper;

    public HyperliquidDataSource(HyperliquidInfoClient infoClient,
                                 @Qualifier("hyperliquidRateLimiter") RateLimiter rateLimiter,
                                 HyperliquidProperties properties,
                                 ObjectMapper objectMapper) {
        this.infoClient = infoClient;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<JsonNode>> getFills(String wallet, Long startTime) {
        return fetchPaginated(USER_FILLS, wallet, startTime);
    }

    @Override
    public Mono<List<JsonNode>> getFunding(String wallet, Long startTime) {
        return fetchPaginated(USER_FUNDING, wallet, startTime);
    }

    @Override
    public Mono<JsonNode> getUserState(String wallet) {
        return request(payload(CLEARINGHOUSE_STATE, wallet, null));
    }

    @Override
    public Mono<JsonNode> getAllMids() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", ALL_MIDS);
        return request(payload);
    }

    private Mono<List<JsonNode>> fetchPaginated(String requestType, String wallet, Long startTime) {
        int pageSize = Math.max(1, properties.getPageSize());
        return fetchPage(requestType, wallet, startTime, pageSize)
                .expand(page -> page.nextStartTime() != null
                        ? fetchPage(requestType, wallet, page.nextStartTime(), pageSize)
                        : Mono.<Page>empty())
                .concatMapIterable(Page::items)
                .collectList();
    }

    private Mono<Page> fetchPage(String requestType, String wallet, Long startTime, int pageSize) {
        return request(payload(requestType, wallet, startTime))
                .map(body -> toPage(body, pageSize))
                .doOnNext(page -> log.debug("{} page for {} from {}: {} items", requestType, wallet, startTime, page.items().size()));
    }

    private Mono<JsonNode> request(Map<String, Object> payload) {
        return infoClient.post(payload)
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .map(this::readTree)
                .defaultIfEmpty(MissingNode.getInstance());
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamApiException("Hyperliquid returned unreadable JSON", e);
        }
    }

    static Map<String, Object> payload(String requestType, String wallet, Long startTime) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", requestType);
        payload.put("user", wallet);
        if (startTime != null) {
            payload.put("startTime", startTime);
        }
        return payload;
    }

    /**
     * Non-array or empty body = empty last page. A full page whose last record has no integral time also ends pagination.
     */
    static Page toPage(JsonNode body, int pageSize) {
        if (body == null || !body.isArray() || body.isEmpty()) {
            return new Page(List.of(), null);
        }
        List<JsonNode> items = new ArrayList<>(body.size());
        body.forEach(items::add);
        if (items.size() < pageSize) {
            return new Page(items, null);
        }
        Long next = JsonFields.longValue(items.get(items.size() - 1), "time")
                .map(time -> time + 1)
                .orElse(null);
        return new Page(items, next);
    }

    record Page(List<JsonNode> items, Long nextStartTime) {
    }
}
