package com.vrforacle.ingestion.job;

import com.vrforacle.common.RetryPolicy;
import com.vrforacle.config.AsyncConfig;
import com.vrforacle.config.VrfOracleContext;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.solana.LogsNotification;
import com.vrforacle.ingestion.adapter.solana.SolanaPubSubClient;
import com.vrforacle.ingestion.config.IngestionAdapterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One reconnecting log subscription per tracked program. Each loop runs for the life of the process:
 * CONNECTING → STREAMING → DISCONNECTED → CONNECTING, with backoff between attempts. Backoff resets
 * once a subscription has been established.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LogSubscriptionSupervisor {

    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final Map<PublicKey, SubscriptionState> states = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final SolanaPubSubClient pubSubClient;
    private final FulfillmentDispatcher dispatcher;
    private final VrfOracleContext context;
    @Qualifier(IngestionAdapterConfig.RECONNECT_RETRY_POLICY)
    private final RetryPolicy reconnectPolicy;
    @Qualifier(AsyncConfig.SUBSCRIPTION_EXECUTOR)
    private final Executor subscriptionExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    void start() {
        if (!started.compareAndSet(false, true)) return;
        for (PublicKey programId : context.programIds()) {
            states.put(programId, SubscriptionState.CONNECTING);
            subscriptionExecutor.execute(() -> superviseLoop(programId));
        }
        log.info("Log subscriptions started: {}", context.programIds().size());
    }

    public Optional<SubscriptionState> getState(PublicKey programId) {
        return Optional.ofNullable(states.get(programId));
    }

    private void superviseLoop(PublicKey programId) {
        int failures = 0;
        while (!Thread.currentThread().isInterrupted()) {
            if (streamOnce(programId)) {
                failures = 0;
            }
            long delay = reconnectPolicy.delayMs(failures);
            failures = Math.min(failures + 1, MAX_BACKOFF_EXPONENT);
            log.warn("Logs subscribe stream ({}) stopped, retrying in {}ms...", programId, delay);
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Log subscription loop for {} exiting", programId);
    }

    /**
     * Opens one subscription and dispatches its notifications until the stream ends or fails.
     * Always leaves the program in DISCONNECTED.
     *
     * @return true if the subscription was established before the stream ended
     */
    boolean streamOnce(PublicKey programId) {
        states.put(programId, SubscriptionState.CONNECTING);
        AtomicBoolean established = new AtomicBoolean(false);
        try {
            Iterable<LogsNotification> notifications = pubSubClient
                    .logsSubscribe(programId, context.commitment(), subscriptionId -> {
                        established.set(true);
                        states.put(programId, SubscriptionState.STREAMING);
                        log.info("Listening for logs from: {} (subscription {})", programId, subscriptionId);
                    })
                    .toIterable();
            for (LogsNotification notification : notifications) {
                dispatcher.dispatch(programId, notification);
            }
        } catch (RuntimeException e) {
            log.warn("Logs subscribe stream ({}) failed: {}", programId, e.getMessage());
        } finally {
            states.put(programId, SubscriptionState.DISCONNECTED);
        }
        return established.get();
    }
}
