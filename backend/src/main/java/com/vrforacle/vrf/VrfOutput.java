package com.vrforacle.vrf;

import com.vrforacle.domain.VrfResult;

/**
 * Proof and the randomness derived from its hash for one seed.
 */
public record VrfOutput(byte[] proof, VrfResult randomness) {

    public VrfOutput {
        proof = proof.clone();
    }

    @Override
    public byte[] proof() {
        return proof.clone();
    }
}
