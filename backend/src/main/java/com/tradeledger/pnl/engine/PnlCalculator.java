package com.tradeledger.pnl.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradeledger.common.JsonFields;
import com.tradeledger.domain.AssetPnl;
import com.tradeledger.domain.DailyPnl;
import com.tradeledger.domain.FillEvent;
import com.tradeledger.domain.FundingEvent;
import com.tradeledger.domain.LiquidationEvent;
import com.tradeledger.domain.PnlSummary;
import com.tradeledger.domain.Timeline;
import com.tradeledger.domain.TimelineEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregates a timeline into PnL figures. Stateless; every figure is an exact BigDecimal sum
 * (add/subtract only, no rounding).
 */
@Component
@RequiredArgsConstructor
public class PnlCalculator {

    private final Clock clock;

    /**
     * Totals and per-coin breakdown. unrealizedPnl comes from the exchange snapshot and only feeds
     * totalPnl/netPnl. An empty timeline yields a zero-width period at the current instant.
     */
    public PnlSummary calculateSummary(String wallet, Timeline timeline, BigDecimal unrealizedPnl) {
        BigDecimal unrealized = unrealizedPnl != null ? unrealizedPnl : BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal funding = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        Map<String, AssetTotals> byCoin = new TreeMap<>();

        for (TimelineEvent event : timeline.events()) {
            switch (event.type()) {
                case FILL -> {
                    FillEvent fill = (FillEvent) event;
                    AssetTotals asset = byCoin.computeIfAbsent(fill.coin(), AssetTotals::new);
                    fees = fees.add(fill.fee());
                    asset.fees = asset.fees.add(fill.fee());
                    asset.tradeCount++;
                    if (fill.realizedPnl() != null) {
                        realized = realized.add(fill.realizedPnl());
                        asset.realized = asset.realized.add(fill.realizedPnl());
                    }
                }
                case FUNDING -> {
                    FundingEvent payment = (FundingEvent) event;
                    AssetTotals asset = byCoin.computeIfAbsent(payment.coin(), AssetTotals::new);
                    funding = funding.add(payment.amount());
                    asset.funding = asset.funding.add(payment.amount());
                }
                case LIQUIDATION, DEPOSIT, WITHDRAWAL -> {
                    // not part of the summary
                }
            }
        }

        Map<String, AssetPnl> byAsset = new TreeMap<>();
        byCoin.forEach((coin, totals) -> byAsset.put(coin, totals.toAssetPnl()));

        BigDecimal total = realized.add(unrealized);
        BigDecimal net = total.add(funding).subtract(fees);
        Instant now = clock.instant();
        return new PnlSummary(
                wallet,
                timeline.fromTimestamp() != null ? timeline.fromTimestamp() : now,
                timeline.toTimestamp() != null ? timeline.toTimestamp() : now,
                realized,
                unrealized,
                total,
                funding,
                fees,
                net,
                Collections.unmodifiableMap(byAsset));
    }

    /**
     * One entry per UTC date with at least one event, ascending, with running cumulative PnL.
     */
    public List<DailyPnl> calculateDaily(Timeline timeline) {
        SortedMap<String, BigDecimal> byDate = new TreeMap<>();
        for (TimelineEvent event : timeline.events()) {
            String date = LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC).toString();
            byDate.merge(date, dailyContribution(event), BigDecimal::add);
        }

        List<DailyPnl> daily = new ArrayList<>(byDate.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> day : byDate.entrySet()) {
            cumulative = cumulative.add(day.getValue());
            daily.add(new DailyPnl(day.getKey(), day.getValue(), cumulative));
        }
        return daily;
    }

    /**
     * Sum of assetPositions[*].position.unrealizedPnl. Missing or unparsable entries count as zero.
     */
    public BigDecimal calculateUnrealizedFromState(JsonNode userState) {
        if (userState == null) {
            return BigDecimal.ZERO;
        }
        JsonNode positions = userState.path("assetPositions");
        if (!positions.isArray()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (JsonNode entry : positions) {
            sum = sum.add(JsonFields.decimal(entry.path("position"), "unrealizedPnl").orElse(BigDecimal.ZERO));
        }
        return sum;
    }

    private static BigDecimal dailyContribution(TimelineEvent event) {
        return switch (event.type()) {
            case FILL -> {
                FillEvent fill = (FillEvent) event;
                BigDecimal realized = fill.realizedPnl() != null ? fill.realizedPnl() : BigDecimal.ZERO;
                yield realized.subtract(fill.fee());
            }
            case FUNDING -> ((FundingEvent) event).amount();
            case LIQUIDATION -> ((LiquidationEvent) event).loss().negate();
            case DEPOSIT, WITHDRAWAL -> BigDecimal.ZERO;
        };
    }

    /** Mutable per-coin accumulator, created on first reference to the coin. */
    private static final class AssetTotals {

        private final String coin;
        private BigDecimal realized = BigDecimal.ZERO;
        private BigDecimal funding = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private int tradeCount;

        private AssetTotals(String coin) {
            this.coin = coin;
        }

        private AssetPnl toAssetPnl() {
            return new AssetPnl(coin, realized, funding, fees, realized.add(funding).subtract(fees), tradeCount);
        }
    }
}
