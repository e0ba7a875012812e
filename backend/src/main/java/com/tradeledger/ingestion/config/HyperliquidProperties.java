package com.tradeledger.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Hyperliquid info API settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.hyperliquid")
@NoArgsConstructor
@Getter
@Setter
public class HyperliquidProperties {

    /** Info endpoint; all requests are JSON POSTs to this URL. */
    private String infoUrl = "https://api.hyperliquid.xyz/info";

    /** Max records the API returns per userFills / userFunding call. */
    private int pageSize = 500;

    /** Local budget of info requests per second for this instance. */
    private int maxRequestsPerSecond = 20;

    /** How long a request may wait for a limiter permit before failing. */
    private long limiterTimeoutMs = 5_000;

    /** Response timeout per upstream call. */
    private int responseTimeoutSeconds = 30;
}
