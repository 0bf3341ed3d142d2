package com.vrforacle.ingestion.adapter.solana;

import java.util.List;

/**
 * Log notification for a transaction that mentions a subscribed program.
 *
 * @param err JSON text of the transaction error, null when the transaction succeeded
 */
public record LogsNotification(String signature, String err, List<String> logs) {

    public LogsNotification {
        logs = List.copyOf(logs);
    }

    public boolean failed() {
        return err != null;
    }
}
