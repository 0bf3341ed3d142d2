package com.vrforacle.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vrforacle.ingestion.config.FulfillmentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
public class CaffeineConfig {

    public static final String HANDLED_SIGNATURES_CACHE = "handledSignaturesCache";

    /** Transaction signature → time it was claimed for fulfillment. */
    @Bean(name = HANDLED_SIGNATURES_CACHE)
    public Cache<String, Instant> handledSignaturesCache(FulfillmentProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getHandledSignaturesTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(properties.getHandledSignaturesMaxSize())
                .build();
    }
}
