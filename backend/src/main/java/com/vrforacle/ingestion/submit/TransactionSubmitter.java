package com.vrforacle.ingestion.submit;

import com.vrforacle.common.Base58;
import com.vrforacle.common.RetryPolicy;
import com.vrforacle.ingestion.adapter.RpcException;
import com.vrforacle.ingestion.adapter.solana.Commitment;
import com.vrforacle.ingestion.adapter.solana.LatestBlockhash;
import com.vrforacle.ingestion.adapter.solana.SignatureStatus;
import com.vrforacle.ingestion.adapter.solana.SolanaLedgerClient;
import com.vrforacle.ingestion.adapter.solana.SolanaRpcErrorException;
import com.vrforacle.ingestion.tx.Instruction;
import com.vrforacle.ingestion.tx.Keypair;
import com.vrforacle.ingestion.tx.SignedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Signs, sends and confirms one instruction, retrying with exponential backoff on retryable failures.
 * <p>
 * At most one signed version of the instruction can land at any time: the transaction is re-signed
 * against a fresh blockhash only once the previous version was rejected for its blockhash or its
 * blockhash has expired. Until then every retry resends the same signed bytes, which the ledger
 * de-duplicates by signature.
 */
@Slf4j
public class TransactionSubmitter {

    private final SolanaLedgerClient ledger;
    private final Keypair signer;
    private final Commitment commitment;
    private final SubmissionErrorClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final SubmissionSettings settings;

    public TransactionSubmitter(SolanaLedgerClient ledger, Keypair signer, Commitment commitment,
                                SubmissionErrorClassifier classifier, RetryPolicy retryPolicy,
                                SubmissionSettings settings) {
        this.ledger = ledger;
        this.signer = signer;
        this.commitment = commitment;
        this.classifier = classifier;
        this.retryPolicy = retryPolicy;
        this.settings = settings;
    }

    /**
     * @return signature of the confirmed transaction
     * @throws SimulationFailedException  if preflight simulation rejected the transaction
     * @throws SubmissionFailedException  on any other terminal error or when the retry budget is spent
     */
    public String submit(Instruction instruction) {
        LatestBlockhash blockhash = null;
        SignedTransaction transaction = null;
        int failures = 0;
        while (true) {
            SubmissionAttempt attempt;
            try {
                if (transaction == null) {
                    blockhash = ledger.getLatestBlockhash(commitment);
                    transaction = SignedTransaction.sign(List.of(instruction), signer, Base58.decode(blockhash.blockhash()));
                }
                log.info("Sending request...");
                attempt = sendAndConfirm(transaction, blockhash.lastValidBlockHeight());
            } catch (RuntimeException e) {
                attempt = classifier.classify(e);
            }

            switch (attempt.outcome()) {
                case SUCCESS -> {
                    return attempt.signature();
                }
                case TERMINAL -> {
                    if (attempt.cause() instanceof SimulationFailedException simulation) {
                        throw simulation;
                    }
                    throw new SubmissionFailedException("Send transaction failed: " + attempt.cause().getMessage(), attempt.cause());
                }
                case RETRYABLE -> {
                    failures++;
                    if (!retryPolicy.canRetry(failures)) {
                        throw new SubmissionFailedException("Send transaction failed after " + failures + " attempts", attempt.cause());
                    }
                    log.warn("Send attempt {} failed, retrying: {}", failures, attempt.cause().getMessage());
                    if (transaction != null && cannotLand(attempt.cause(), blockhash)) {
                        LatestBlockhash refreshed = refreshBlockhash(blockhash);
                        if (refreshed != null) {
                            blockhash = refreshed;
                            transaction = transaction.withRecentBlockhash(Base58.decode(refreshed.blockhash()), signer);
                        }
                    }
                    sleep(retryPolicy.delayMs(failures - 1));
                }
            }
        }
    }

    SubmissionAttempt sendAndConfirm(SignedTransaction transaction, long lastValidBlockHeight) {
        String signature;
        try {
            signature = ledger.sendTransaction(transaction.toBase64(), settings.skipPreflight(), commitment);
        } catch (SolanaRpcErrorException e) {
            if (!hasTransactionError(e, TransactionFailedException.ALREADY_PROCESSED)) {
                throw e;
            }
            signature = transaction.getSignature();
            log.info("Transaction {} already processed, confirming it", signature);
        }
        long deadline = System.currentTimeMillis() + settings.confirmationTimeoutMs();
        while (true) {
            Optional<SignatureStatus> status = ledger.getSignatureStatus(signature);
            if (status.isPresent()) {
                if (status.get().error().isPresent()) {
                    throw new TransactionFailedException(signature, status.get().errorName());
                }
                if (commitment.isSatisfiedBy(status.get().confirmationStatus())) {
                    return SubmissionAttempt.success(signature);
                }
            } else if (ledger.getBlockHeight(commitment) > lastValidBlockHeight) {
                throw new TransactionFailedException(signature, TransactionFailedException.BLOCKHASH_NOT_FOUND);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new RpcException("confirmation of " + signature + " timed out");
            }
            sleep(settings.confirmationPollIntervalMs());
        }
    }

    /** True when the last signed version was rejected for its blockhash or can no longer be included. */
    private boolean cannotLand(RuntimeException cause, LatestBlockhash blockhash) {
        if (cause instanceof TransactionFailedException failed
                && TransactionFailedException.BLOCKHASH_NOT_FOUND.equals(failed.getErrorName())) {
            return true;
        }
        if (cause instanceof SolanaRpcErrorException rpcError
                && hasTransactionError(rpcError, TransactionFailedException.BLOCKHASH_NOT_FOUND)) {
            return true;
        }
        try {
            return ledger.getBlockHeight(commitment) > blockhash.lastValidBlockHeight();
        } catch (RuntimeException e) {
            log.debug("Block height check failed, resending the same transaction: {}", e.getMessage());
            return false;
        }
    }

    private static boolean hasTransactionError(SolanaRpcErrorException e, String errorName) {
        return e.getTransactionErrorName().filter(errorName::equals).isPresent();
    }

    /** Best effort: null when the refresh fails or the node still serves the same blockhash. */
    private LatestBlockhash refreshBlockhash(LatestBlockhash current) {
        try {
            LatestBlockhash latest = ledger.getLatestBlockhash(commitment);
            if (current != null && latest.blockhash().equals(current.blockhash())) {
                return null;
            }
            return latest;
        } catch (RuntimeException e) {
            log.debug("Blockhash refresh failed, keeping current one: {}", e.getMessage());
            return null;
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmissionFailedException("Interrupted while waiting to resend", e);
        }
    }

    /**
     * @param confirmationTimeoutMs upper bound for one attempt's confirmation wait
     */
    public record SubmissionSettings(boolean skipPreflight, long confirmationPollIntervalMs, long confirmationTimeoutMs) {
    }
}
