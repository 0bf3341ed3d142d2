package com.vrforacle.ingestion.job;

import com.vrforacle.config.AsyncConfig;
import com.vrforacle.config.VrfOracleContext;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.solana.Commitment;
import com.vrforacle.ingestion.adapter.solana.SignatureInfo;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.adapter.solana.TransactionLogs;
import com.vrforacle.ingestion.config.BackfillProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-time startup replay of each tracked program's recent, non-failed transactions through the
 * fulfillment pipeline, to pick up requests made while the service was down. Transactions are replayed
 * newest first and one at a time; a failing transaction is logged and the replay moves on.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HistoricalBackfillJob {

    private final AtomicBoolean started = new AtomicBoolean(false);

    private final SolanaLedgerClient ledgerClient;
    private final FulfillmentDispatcher dispatcher;
    private final VrfOracleContext context;
    private final BackfillProperties backfillProperties;
    @Qualifier(AsyncConfig.BACKFILL_EXECUTOR)
    private final Executor backfillExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!backfillProperties.isEnabled()) {
            log.info("Backfill disabled");
            return;
        }
        if (!started.compareAndSet(false, true)) return;
        backfillExecutor.execute(this::run);
    }

    void run() {
        Commitment commitment = Commitment.parse(backfillProperties.getCommitment());
        for (PublicKey programId : context.programIds()) {
            try {
                backfillProgram(programId, commitment);
            } catch (RuntimeException e) {
                log.error("Backfill for program {} aborted: {}", programId, e.getMessage(), e);
            }
        }
        log.info("Backfill complete");
    }

    /**
     * @return number of transactions whose logs were run through the pipeline
     */
    int backfillProgram(PublicKey programId, Commitment commitment) {
        List<SignatureInfo> fetched = listSignatures(programId, commitment);
        List<SignatureInfo> succeeded = fetched.stream().filter(s -> !s.failed()).toList();
        if (succeeded.isEmpty()) {
            return 0;
        }
        log.info("Process old transaction: processing {} in {} fetched transactions", succeeded.size(), fetched.size());

        int processed = 0;
        for (SignatureInfo info : succeeded) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Backfill for {} interrupted", programId);
                break;
            }
            if (replay(programId, info.signature(), commitment)) {
                processed++;
            }
        }
        return processed;
    }

    private boolean replay(PublicKey programId, String signature, Commitment commitment) {
        try {
            Optional<TransactionLogs> tx = ledgerClient.getTransactionLogs(signature, commitment);
            if (tx.isEmpty() || tx.get().failed() || tx.get().logs().isEmpty()) {
                log.debug("Transaction {} has no usable logs, skipping", signature);
                return false;
            }
            dispatcher.processNow(programId, signature, tx.get().logs())
                    .ifPresent(o -> log.info("Fulfilled old request {} with callback {}", o.requestAccount(), o.transaction()));
            return true;
        } catch (RuntimeException e) {
            log.error("Error processing old transaction {}: {}", signature, e.getMessage(), e);
            return false;
        }
    }

    /** Newest first, paged by the {@code before} cursor until the node runs out or the configured cap is hit. */
    List<SignatureInfo> listSignatures(PublicKey programId, Commitment commitment) {
        int max = Math.max(0, backfillProperties.getMaxSignatures());
        int pageSize = Math.max(1, Math.min(backfillProperties.getPageSize(), SolanaLedgerClient.MAX_SIGNATURES_LIMIT));
        List<SignatureInfo> all = new ArrayList<>();
        String before = null;
        while (all.size() < max) {
            int limit = Math.min(pageSize, max - all.size());
            List<SignatureInfo> page = ledgerClient.getSignaturesForAddress(programId, before, limit, commitment);
            all.addAll(page);
            if (page.size() < limit) {
                break;
            }
            before = page.get(page.size() - 1).signature();
        }
        return all;
    }
}
