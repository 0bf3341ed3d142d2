package com.vrforacle.ingestion.tx;

import com.vrforacle.domain.PublicKey;

import java.util.List;

/**
 * Executable instruction: target program, ordered account list and opaque data.
 */
public record Instruction(PublicKey programId, List<AccountMeta> accounts, byte[] data) {

    public Instruction {
        accounts = List.copyOf(accounts);
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
