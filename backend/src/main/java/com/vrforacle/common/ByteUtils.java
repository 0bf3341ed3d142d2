package com.vrforacle.common;

import java.math.BigInteger;

/**
 * Byte array helpers shared by the wire decoders and the VRF.
 */
public final class ByteUtils {

    private ByteUtils() {
    }

    /**
     * Offset of the first byte-exact occurrence of {@code pattern} in {@code data}, or -1.
     */
    public static int indexOf(byte[] data, byte[] pattern) {
        if (pattern.length == 0 || pattern.length > data.length) {
            return -1;
        }
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    public static boolean startsWith(byte[] data, byte[] prefix) {
        if (data == null || data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    public static boolean isAllZero(byte[] data) {
        for (byte b : data) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Unsigned big-endian encoding of {@code value}, left-padded with zeros to {@code length} bytes.
     */
    public static byte[] toFixedLength(BigInteger value, int length) {
        byte[] raw = value.toByteArray();
        if (raw.length == length) {
            return raw;
        }
        byte[] out = new byte[length];
        if (raw.length > length) {
            int extra = raw.length - length;
            for (int i = 0; i < extra; i++) {
                if (raw[i] != 0) {
                    throw new IllegalArgumentException("value does not fit in " + length + " bytes");
                }
            }
            System.arraycopy(raw, extra, out, 0, length);
        } else {
            System.arraycopy(raw, 0, out, length - raw.length, raw.length);
        }
        return out;
    }

    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] p : parts) {
            total += p.length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }
}
