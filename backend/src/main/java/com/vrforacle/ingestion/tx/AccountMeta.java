package com.vrforacle.ingestion.tx;

import com.vrforacle.domain.PublicKey;

public record AccountMeta(PublicKey pubkey, boolean isSigner, boolean isWritable) {
}
