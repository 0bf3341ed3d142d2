package com.vrforacle.ingestion.adapter.solana;

import java.util.Locale;

/**
 * Ledger commitment level, ordered from weakest to strongest.
 */
public enum Commitment {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True if a signature status at {@code confirmationStatus} meets this level. */
    public boolean isSatisfiedBy(String confirmationStatus) {
        if (confirmationStatus == null) {
            return false;
        }
        return parse(confirmationStatus).ordinal() >= ordinal();
    }

    public static Commitment parse(String value) {
        if (value != null) {
            for (Commitment c : values()) {
                if (c.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("unknown commitment: " + value);
    }
}
