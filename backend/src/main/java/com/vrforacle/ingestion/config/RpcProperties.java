package com.vrforacle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger HTTP RPC client limits.
 */
@ConfigurationProperties(prefix = "vrf-oracle.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** Per-request timeout in ms. */
    private long timeoutMs = 30_000L;

    /** Local limiter: max RPC requests per second across all tasks. */
    private int maxRequestsPerSecond = 40;

    /** Max time a caller waits for a limiter permit before the call fails. */
    private long localLimiterTimeoutMs = 30_000L;
}
