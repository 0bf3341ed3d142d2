package com.vrforacle.ingestion.parser;

import com.vrforacle.common.ByteUtils;
import com.vrforacle.domain.PublicKey;

/**
 * Decoded data record emitted by a tracked program.
 */
public record ProgramEvent(PublicKey programId, byte[] data) {

    public ProgramEvent {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public boolean hasDiscriminator(byte[] discriminator) {
        return ByteUtils.startsWith(data, discriminator);
    }
}
