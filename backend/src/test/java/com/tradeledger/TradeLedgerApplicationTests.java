package com.tradeledger;

import com.tradeledger.ingestion.adapter.TradingDataSource;
import com.tradeledger.ingestion.adapter.hyperliquid.HyperliquidDataSource;
import com.tradeledger.ingestion.config.HyperliquidProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "tradeledger.hyperliquid.info-url=http://localhost:1/info",
        "tradeledger.hyperliquid.max-requests-per-second=7",
        "tradeledger.hyperliquid.limiter-timeout-ms=250"
})
class TradeLedgerApplicationTests {

    @Autowired
    TradingDataSource dataSource;

    @Autowired
    HyperliquidProperties properties;

    @Autowired
    @Qualifier("hyperliquidRateLimiter")
    RateLimiter rateLimiter;

    @Test
    @DisplayName("context loads with Hyperliquid client, limiter and properties")
    void contextLoads_withHyperliquidWiring() {
        assertThat(dataSource).isInstanceOf(HyperliquidDataSource.class);
        assertThat(properties.getInfoUrl()).isEqualTo("http://localhost:1/info");
        assertThat(properties.getPageSize()).isEqualTo(500);
        assertThat(rateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(7);
        assertThat(rateLimiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(250));
    }
}
