package com.vrforacle.fulfillment;

import com.vrforacle.domain.PublicKey;
import com.vrforacle.domain.VrfResult;

/**
 * A submitted and confirmed callback.
 *
 * @param transaction   signature of the callback transaction
 * @param requestAccount randomness request record that was fulfilled
 * @param seeds         request seed the randomness was derived from
 * @param proof         VRF proof over {@code seeds}
 * @param randomness    value written into the callback
 */
public record FulfillmentOutcome(String transaction, PublicKey requestAccount, byte[] seeds, byte[] proof, VrfResult randomness) {

    public FulfillmentOutcome {
        seeds = seeds.clone();
        proof = proof.clone();
    }

    @Override
    public byte[] seeds() {
        return seeds.clone();
    }

    @Override
    public byte[] proof() {
        return proof.clone();
    }
}
