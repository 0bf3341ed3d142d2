package com.vrforacle.domain;

import com.vrforacle.common.Base58;

import java.util.Arrays;

/**
 * 32-byte ledger address (account, program or signer). Immutable; text form is base58.
 */
public final class PublicKey {

    public static final int LENGTH = 32;

    private final byte[] bytes;

    private PublicKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static PublicKey of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("public key must be " + LENGTH + " bytes");
        }
        return new PublicKey(bytes.clone());
    }

    /**
     * @throws IllegalArgumentException if the text is not base58 or does not decode to 32 bytes
     */
    public static PublicKey fromBase58(String base58) {
        byte[] decoded = Base58.decode(base58 == null ? "" : base58.trim());
        if (decoded.length != LENGTH) {
            throw new IllegalArgumentException("invalid public key: " + base58);
        }
        return new PublicKey(decoded);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toBase58() {
        return Base58.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublicKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
