package com.vrforacle.ingestion.submit;

import com.vrforacle.ingestion.adapter.RpcException;
import com.vrforacle.ingestion.adapter.solana.SolanaRpcErrorException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a failed attempt to retryable or terminal. Retryable: transport failures, unhealthy nodes,
 * and the stale-blockhash / duplicate transaction errors. Terminal: preflight rejections with
 * simulated logs and everything else.
 */
@Component
public class SubmissionErrorClassifier {

    private static final Set<String> RETRYABLE_TRANSACTION_ERRORS = Set.of(
            TransactionFailedException.BLOCKHASH_NOT_FOUND,
            TransactionFailedException.ALREADY_PROCESSED);

    public SubmissionAttempt classify(RuntimeException e) {
        if (e instanceof SolanaRpcErrorException rpcError) {
            if (rpcError.getTransactionErrorName().filter(RETRYABLE_TRANSACTION_ERRORS::contains).isPresent()) {
                return SubmissionAttempt.retryable(e);
            }
            Optional<List<String>> logs = rpcError.getSimulationLogs();
            if (rpcError.isPreflightFailure() && logs.isPresent()) {
                return SubmissionAttempt.terminal(new SimulationFailedException(logs.get(), e));
            }
            return rpcError.isNodeTransient() ? SubmissionAttempt.retryable(e) : SubmissionAttempt.terminal(e);
        }
        if (e instanceof TransactionFailedException failed) {
            return RETRYABLE_TRANSACTION_ERRORS.contains(failed.getErrorName())
                    ? SubmissionAttempt.retryable(e)
                    : SubmissionAttempt.terminal(e);
        }
        if (e instanceof RpcException) {
            return SubmissionAttempt.retryable(e);
        }
        return SubmissionAttempt.terminal(e);
    }
}
