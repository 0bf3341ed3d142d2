package com.vrforacle.vrf;

import com.vrforacle.common.Base58;
import com.vrforacle.domain.VrfResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Holds the oracle's VRF secret and computes proof and randomness for request seeds.
 * Every call is a pure function of (secret, seed); no per-call state is shared, so the engine
 * serves concurrent fulfillments without locking.
 */
@Slf4j
public class VrfEngine {

    private final EcVrf vrf;
    private final byte[] secretKey;
    private final byte[] publicKey;

    public VrfEngine(EcVrf vrf, byte[] secretKey) {
        this.vrf = vrf;
        this.secretKey = secretKey.clone();
        this.publicKey = vrf.derivePublicKey(this.secretKey);
        log.info("VRF engine ready, public key: {}", Base58.encode(publicKey));
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    /**
     * Proof for {@code seeds} and the randomness taken from the leading bytes of its hash.
     *
     * @throws IllegalStateException if the derived value equals the unfulfilled sentinel or is all zero
     */
    public VrfOutput proveAndHash(byte[] seeds) {
        byte[] proof = vrf.prove(secretKey, seeds);
        byte[] hash = vrf.proofToHash(proof);
        VrfResult randomness = VrfResult.of(Arrays.copyOf(hash, VrfResult.LENGTH));
        if (!randomness.isFulfilled()) {
            throw new IllegalStateException("VRF output collides with a reserved result value");
        }
        return new VrfOutput(proof, randomness);
    }
}
