package com.vrforacle.ingestion.tx;

import com.vrforacle.domain.PublicKey;
import lombok.Getter;

/**
 * Thrown when a transaction needs a signature the oracle cannot provide.
 */
@Getter
public class MissingSignerException extends RuntimeException {

    private final PublicKey signer;

    public MissingSignerException(PublicKey signer) {
        super("transaction requires a signature from " + signer + ", which is not the oracle signer");
        this.signer = signer;
    }
}
