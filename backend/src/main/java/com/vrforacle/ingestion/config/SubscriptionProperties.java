package com.vrforacle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reconnect backoff for the per-program log subscriptions.
 */
@ConfigurationProperties(prefix = "vrf-oracle.subscription")
@NoArgsConstructor
@Getter
@Setter
public class SubscriptionProperties {

    private long reconnectBaseDelayMs = 500L;

    private long reconnectMaxDelayMs = 60_000L;

    private double jitterFactor = 0.2;
}
