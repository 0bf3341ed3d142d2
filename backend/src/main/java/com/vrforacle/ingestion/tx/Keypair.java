package com.vrforacle.ingestion.tx;

import com.vrforacle.domain.PublicKey;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Arrays;

/**
 * Ed25519 signing identity. Immutable and safe to share; each signature uses a fresh signer.
 */
public final class Keypair {

    public static final int SECRET_KEY_LENGTH = 64;
    public static final int SIGNATURE_LENGTH = 64;

    private final Ed25519PrivateKeyParameters privateKey;
    private final PublicKey publicKey;

    private Keypair(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = PublicKey.of(privateKey.generatePublicKey().getEncoded());
    }

    public static Keypair fromSeed(byte[] seed) {
        if (seed == null || seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("ed25519 seed must be 32 bytes");
        }
        return new Keypair(new Ed25519PrivateKeyParameters(seed, 0));
    }

    /**
     * From the 64-byte {@code seed || public key} form written by solana-keygen.
     *
     * @throws IllegalArgumentException if the length is wrong or the halves do not match
     */
    public static Keypair fromSecretKey(byte[] secretKey) {
        if (secretKey == null || secretKey.length != SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("keypair must be " + SECRET_KEY_LENGTH + " bytes");
        }
        Keypair keypair = fromSeed(Arrays.copyOfRange(secretKey, 0, 32));
        if (!keypair.publicKey.equals(PublicKey.of(Arrays.copyOfRange(secretKey, 32, 64)))) {
            throw new IllegalArgumentException("keypair public key does not match its seed");
        }
        return keypair;
    }

    public PublicKey getPublicKey() {
        return publicKey;
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public String toString() {
        return "Keypair(" + publicKey + ")";
    }
}
