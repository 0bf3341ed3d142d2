package com.vrforacle.ingestion.submit;

import lombok.Getter;

/**
 * The ledger reported a transaction error for a sent transaction.
 */
@Getter
public class TransactionFailedException extends RuntimeException {

    public static final String BLOCKHASH_NOT_FOUND = "BlockhashNotFound";
    public static final String ALREADY_PROCESSED = "AlreadyProcessed";

    private final String signature;
    private final String errorName;

    public TransactionFailedException(String signature, String errorName) {
        super("transaction " + signature + " failed: " + errorName);
        this.signature = signature;
        this.errorName = errorName;
    }
}
