package com.vrforacle.ingestion.adapter.solana;

import java.util.Optional;

/**
 * Status of a sent transaction.
 *
 * @param confirmationStatus processed, confirmed or finalized
 * @param errorName          transaction error variant, null on success
 */
public record SignatureStatus(long slot, String confirmationStatus, String errorName) {

    public Optional<String> error() {
        return Optional.ofNullable(errorName);
    }
}
