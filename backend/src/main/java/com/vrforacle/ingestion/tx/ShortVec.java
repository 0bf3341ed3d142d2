package com.vrforacle.ingestion.tx;

import java.io.ByteArrayOutputStream;

/**
 * Compact-u16 length prefix: 7 bits per byte, high bit set on all but the last byte.
 */
final class ShortVec {

    private ShortVec() {
    }

    static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0 || length > 0xFFFF) {
            throw new IllegalArgumentException("length out of compact-u16 range: " + length);
        }
        int rem = length;
        while (true) {
            int elem = rem & 0x7F;
            rem >>>= 7;
            if (rem == 0) {
                out.write(elem);
                return;
            }
            out.write(elem | 0x80);
        }
    }
}
