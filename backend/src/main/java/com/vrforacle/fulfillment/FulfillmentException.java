package com.vrforacle.fulfillment;

import lombok.Getter;

/**
 * Terminal failure of one transaction's fulfillment: malformed logs or on-chain data that cannot be
 * trusted. Never retried.
 */
@Getter
public class FulfillmentException extends RuntimeException {

    public enum Reason {
        PARSE_ERRORS,
        PROGRAM_ID_MISMATCH,
        MALFORMED_EVENT,
        INVALID_DISCRIMINATOR,
        MALFORMED_ACCOUNT,
        ALREADY_FULFILLED,
        RANDOMNESS_UNAVAILABLE,
        PLACEHOLDER_NOT_FOUND,
        UNSUPPORTED_SIGNER
    }

    private final Reason reason;

    public FulfillmentException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FulfillmentException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
