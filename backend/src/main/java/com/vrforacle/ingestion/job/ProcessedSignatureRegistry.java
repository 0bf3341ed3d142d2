package com.vrforacle.ingestion.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.vrforacle.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Recently handled transaction signatures, shared by live dispatch and the backfill so a transaction
 * seen on both paths is fulfilled once per process. Bounded and time-expiring.
 */
@Component
@RequiredArgsConstructor
public class ProcessedSignatureRegistry {

    @Qualifier(CaffeineConfig.HANDLED_SIGNATURES_CACHE)
    private final Cache<String, Instant> handledSignatures;

    /**
     * Claims the signature.
     *
     * @return true if this caller is the first to claim it
     */
    public boolean markIfNew(String signature) {
        return handledSignatures.asMap().putIfAbsent(signature, Instant.now()) == null;
    }
}
