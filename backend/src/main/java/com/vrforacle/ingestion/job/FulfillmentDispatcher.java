package com.vrforacle.ingestion.job;

import com.vrforacle.config.AsyncConfig;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.fulfillment.FulfillmentOutcome;
import com.vrforacle.fulfillment.FulfillmentPipeline;
import com.vrforacle.ingestion.adapter.solana.LogsNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Hands each log notification to the fulfillment pipeline as an independent unit on the fulfillment
 * executor. The caller never waits; the outcome of every unit is reported by its completion callback.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FulfillmentDispatcher {

    static final String MDC_PROGRAM_ID = "programId";
    static final String MDC_TRANSACTION = "transaction";

    private final FulfillmentPipeline pipeline;
    private final ProcessedSignatureRegistry processedSignatures;
    @Qualifier(AsyncConfig.FULFILLMENT_EXECUTOR)
    private final Executor fulfillmentExecutor;

    /**
     * Schedules fulfillment of a live notification. Failed transactions and signatures already
     * handled are skipped with an already-completed empty future.
     */
    public CompletableFuture<Optional<FulfillmentOutcome>> dispatch(PublicKey programId, LogsNotification notification) {
        String signature = notification.signature();
        if (notification.failed()) {
            withContext(programId, signature, () -> log.info("Skipping error transaction: {}", notification.err()));
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!processedSignatures.markIfNew(signature)) {
            log.debug("Transaction {} already handled, skipping", signature);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture
                .supplyAsync(() -> runInContext(programId, signature, notification.logs()), fulfillmentExecutor)
                .whenComplete((outcome, error) -> withContext(programId, signature, () -> report(outcome, error)));
    }

    /**
     * Runs one historical transaction on the calling thread.
     *
     * @return the outcome, or empty when already handled or nothing to fulfill
     * @throws RuntimeException any fulfillment failure, for the caller to log
     */
    public Optional<FulfillmentOutcome> processNow(PublicKey programId, String signature, List<String> logs) {
        if (!processedSignatures.markIfNew(signature)) {
            log.debug("Transaction {} already handled, skipping", signature);
            return Optional.empty();
        }
        return runInContext(programId, signature, logs);
    }

    private Optional<FulfillmentOutcome> runInContext(PublicKey programId, String signature, List<String> logs) {
        try (MDC.MDCCloseable p = MDC.putCloseable(MDC_PROGRAM_ID, programId.toBase58());
             MDC.MDCCloseable t = MDC.putCloseable(MDC_TRANSACTION, signature)) {
            log.info("Start processing");
            return pipeline.process(programId, logs);
        }
    }

    private static void report(Optional<FulfillmentOutcome> outcome, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.error("Error processing transaction: {}", cause.getMessage(), cause);
            return;
        }
        outcome.ifPresentOrElse(
                o -> log.info("Finished! callback {}", o.transaction()),
                () -> log.info("Finished!"));
    }

    private static void withContext(PublicKey programId, String signature, Runnable action) {
        try (MDC.MDCCloseable p = MDC.putCloseable(MDC_PROGRAM_ID, programId.toBase58());
             MDC.MDCCloseable t = MDC.putCloseable(MDC_TRANSACTION, signature)) {
            action.run();
        }
    }
}
