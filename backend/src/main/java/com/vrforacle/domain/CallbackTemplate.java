package com.vrforacle.domain;

import java.util.List;

/**
 * Pre-registered callback instruction, completed off-chain by writing the randomness over the placeholder.
 * {@code ixData} is already truncated to the stored data length.
 */
public record CallbackTemplate(PublicKey programId, List<AccountMetaPacked> accounts, byte[] ixData) {

    public CallbackTemplate {
        accounts = List.copyOf(accounts);
        ixData = ixData.clone();
    }

    @Override
    public byte[] ixData() {
        return ixData.clone();
    }
}
