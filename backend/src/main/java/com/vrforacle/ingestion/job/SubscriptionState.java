package com.vrforacle.ingestion.job;

/**
 * Lifecycle of one tracked program's log subscription. DISCONNECTED always leads back to CONNECTING.
 */
public enum SubscriptionState {
    CONNECTING,
    STREAMING,
    DISCONNECTED
}
