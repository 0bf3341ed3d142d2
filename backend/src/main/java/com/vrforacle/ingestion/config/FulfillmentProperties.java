package com.vrforacle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-notification worker pool and the recently-handled signature set.
 */
@ConfigurationProperties(prefix = "vrf-oracle.fulfillment")
@NoArgsConstructor
@Getter
@Setter
public class FulfillmentProperties {

    private int workerThreads = 8;

    private long handledSignaturesMaxSize = 10_000;

    private long handledSignaturesTtlMinutes = 120;
}
