package com.vrforacle.vrf;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EcVrfTest {

    private static final byte[] SECRET = Hex.decode("c9afa9d845ba75166b5c215767b1d6934e50c3db36e89b127b8a622b120f6721");
    private static final byte[] ALPHA = "sample".getBytes(StandardCharsets.US_ASCII);

    private final EcVrf vrf = new EcVrf();

    @Test
    void derivePublicKey_ofOne_isCompressedGenerator() {
        byte[] one = new byte[32];
        one[31] = 1;
        assertThat(Hex.toHexString(vrf.derivePublicKey(one)))
                .isEqualTo("0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798");
    }

    @Test
    @DisplayName("public key, Gamma and output match the secp256k1 'sample' vector")
    void prove_knownVector_matchesGammaAndOutput() {
        byte[] proof = vrf.prove(SECRET, ALPHA);

        assertThat(Hex.toHexString(vrf.derivePublicKey(SECRET)))
                .isEqualTo("032c8c31fc9f990c6b55e3865a184a4ce50e09481f2eaeb3e60ec1cea13a6ae645");
        assertThat(Hex.toHexString(Arrays.copyOf(proof, 33)))
                .isEqualTo("031f4dbca087a1972d04a07a779b7df1caa99e0f5db2aa21f3aecc4f9e10e85d08");
        assertThat(Hex.toHexString(vrf.proofToHash(proof)))
                .isEqualTo("612065e309e937ef46c2ef04d5886b9c6efd2991ac484ec64a9b014366fc5d81");
    }

    @Test
    @DisplayName("same secret and seed always give the same proof and output")
    void prove_isDeterministic() {
        byte[] first = vrf.prove(SECRET, ALPHA);
        byte[] second = vrf.prove(SECRET, ALPHA);

        assertThat(first).hasSize(EcVrf.PROOF_LENGTH).isEqualTo(second);
        assertThat(vrf.proofToHash(first)).hasSize(EcVrf.HASH_LENGTH).isEqualTo(vrf.proofToHash(second));
    }

    @Test
    void prove_differentSeeds_giveDifferentOutputs() {
        byte[] a = vrf.proofToHash(vrf.prove(SECRET, ALPHA));
        byte[] b = vrf.proofToHash(vrf.prove(SECRET, "other".getBytes(StandardCharsets.US_ASCII)));
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void verify_validProof_returnsOutput() {
        byte[] proof = vrf.prove(SECRET, ALPHA);
        byte[] publicKey = vrf.derivePublicKey(SECRET);

        assertThat(vrf.verify(publicKey, proof, ALPHA)).isEqualTo(vrf.proofToHash(proof));
    }

    @Test
    void verify_wrongSeed_throws() {
        byte[] proof = vrf.prove(SECRET, ALPHA);
        byte[] publicKey = vrf.derivePublicKey(SECRET);

        assertThatThrownBy(() -> vrf.verify(publicKey, proof, "tampered".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(InvalidProofException.class);
    }

    @Test
    void verify_tamperedScalar_throws() {
        byte[] proof = vrf.prove(SECRET, ALPHA);
        proof[EcVrf.PROOF_LENGTH - 1] ^= 1;

        assertThatThrownBy(() -> vrf.verify(vrf.derivePublicKey(SECRET), proof, ALPHA))
                .isInstanceOf(InvalidProofException.class);
    }

    @Test
    void verify_truncatedProof_throws() {
        assertThatThrownBy(() -> vrf.verify(vrf.derivePublicKey(SECRET), new byte[10], ALPHA))
                .isInstanceOf(InvalidProofException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void prove_zeroSecret_rejected() {
        assertThatThrownBy(() -> vrf.prove(new byte[32], ALPHA)).isInstanceOf(IllegalArgumentException.class);
    }
}
