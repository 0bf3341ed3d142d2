package com.vrforacle.domain;

/**
 * Randomness request record as stored on-chain (after its 8-byte discriminator).
 */
public record VrfAccountData(
        VrfResult result,
        byte[] proof,
        byte[] seeds,
        long requestTimestamp,
        CallbackTemplate callback
) {

    public VrfAccountData {
        proof = proof.clone();
        seeds = seeds.clone();
    }

    @Override
    public byte[] proof() {
        return proof.clone();
    }

    @Override
    public byte[] seeds() {
        return seeds.clone();
    }
}
