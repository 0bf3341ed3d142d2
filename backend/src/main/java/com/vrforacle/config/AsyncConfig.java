package com.vrforacle.config;

import com.vrforacle.ingestion.config.FulfillmentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: one long-lived loop per tracked program's subscription, a pool for
 * per-notification fulfillment units, and a single thread for the startup backfill.
 */
@Configuration
public class AsyncConfig {

    public static final String SUBSCRIPTION_EXECUTOR = "subscription-executor";
    public static final String FULFILLMENT_EXECUTOR = "fulfillment-executor";
    public static final String BACKFILL_EXECUTOR = "backfill-executor";

    /** Loops never return, so the pool grows to one thread per tracked program. */
    @Bean(name = SUBSCRIPTION_EXECUTOR)
    public ThreadPoolTaskExecutor subscriptionExecutor(VrfOracleContext context) {
        int programs = Math.max(1, context.programIds().size());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(programs);
        e.setMaxPoolSize(programs);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("logs-subscribe-");
        e.initialize();
        return e;
    }

    /** Unbounded queue: a burst of notifications waits for workers instead of stalling the streams. */
    @Bean(name = FULFILLMENT_EXECUTOR)
    public ThreadPoolTaskExecutor fulfillmentExecutor(FulfillmentProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("fulfill-");
        e.initialize();
        return e;
    }

    @Bean(name = BACKFILL_EXECUTOR)
    public ThreadPoolTaskExecutor backfillExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("backfill-");
        e.initialize();
        return e;
    }
}
