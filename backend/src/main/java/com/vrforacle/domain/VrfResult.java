package com.vrforacle.domain;

import com.vrforacle.common.ByteUtils;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Fixed-length randomness slot of a request record. Until fulfilled it holds {@link #SENTINEL};
 * the sentinel and an all-zero value are never usable randomness.
 */
public final class VrfResult {

    public static final int LENGTH = 32;

    /** Placeholder written by the requesting program, both in the record and in callback instruction data. */
    private static final byte[] SENTINEL = {
            (byte) 169, (byte) 181, 96, 37, (byte) 231, (byte) 213, (byte) 250, 114,
            103, (byte) 201, (byte) 179, (byte) 141, 92, 38, 30, 87,
            115, (byte) 210, 50, 29, (byte) 136, (byte) 193, 41, (byte) 211,
            45, (byte) 205, 112, (byte) 191, (byte) 205, (byte) 195, 2, 105
    };

    private final byte[] value;

    private VrfResult(byte[] value) {
        this.value = value;
    }

    public static VrfResult of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("VRF result must be " + LENGTH + " bytes");
        }
        return new VrfResult(value.clone());
    }

    public static VrfResult unfulfilled() {
        return new VrfResult(SENTINEL.clone());
    }

    public static byte[] sentinel() {
        return SENTINEL.clone();
    }

    /** False for the sentinel pattern and for all zeros. */
    public boolean isFulfilled() {
        return !ByteUtils.isAllZero(value) && !Arrays.equals(value, SENTINEL);
    }

    public byte[] toBytes() {
        return value.clone();
    }

    /**
     * Bounded integer derived from the first 16 bytes (big-endian, signed): {@code (rand % (max - min)) + min}.
     *
     * @throws IllegalStateException if the result is not fulfilled
     */
    public long random(long min, long max) {
        if (!isFulfilled()) {
            throw new IllegalStateException("VrfNotFulfilled: random() called on an unfulfilled result");
        }
        if (max <= min) {
            throw new IllegalArgumentException("max must be greater than min");
        }
        BigInteger rand = new BigInteger(Arrays.copyOfRange(value, 0, 16));
        BigInteger bound = BigInteger.valueOf(max).subtract(BigInteger.valueOf(min));
        // BigInteger.remainder keeps the dividend's sign, like the on-chain i128 '%'
        return rand.remainder(bound).add(BigInteger.valueOf(min)).longValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VrfResult other)) return false;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
