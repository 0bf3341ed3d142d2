package com.vrforacle.ingestion.adapter.solana;

import com.vrforacle.domain.PublicKey;
import reactor.core.publisher.Flux;

import java.util.function.LongConsumer;

/**
 * Ledger pub/sub (websocket) subscriptions.
 */
public interface SolanaPubSubClient {

    /**
     * Log notifications for transactions that mention {@code programId}. The flux completes when the
     * server closes the connection and errors when the connection or the subscribe request fails.
     *
     * @param onSubscribed receives the subscription id once the node accepts the subscription
     */
    Flux<LogsNotification> logsSubscribe(PublicKey programId, Commitment commitment, LongConsumer onSubscribed);
}
