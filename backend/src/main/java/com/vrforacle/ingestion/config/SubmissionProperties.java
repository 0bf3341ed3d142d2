package com.vrforacle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Callback submission retry and confirmation settings.
 */
@ConfigurationProperties(prefix = "vrf-oracle.submission")
@NoArgsConstructor
@Getter
@Setter
public class SubmissionProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Max failed attempts before the submission is abandoned. */
    private int maxAttempts = 10;

    /** Backoff ceiling in ms. */
    private long maxDelayMs = 30_000L;

    private boolean skipPreflight = false;

    private long confirmationPollIntervalMs = 500L;

    private long confirmationTimeoutMs = 60_000L;
}
