package com.vrforacle.ingestion.adapter.solana;

import java.util.List;

/**
 * Recorded outcome and log lines of a confirmed transaction.
 */
public record TransactionLogs(String signature, boolean failed, List<String> logs) {

    public TransactionLogs {
        logs = List.copyOf(logs);
    }
}
