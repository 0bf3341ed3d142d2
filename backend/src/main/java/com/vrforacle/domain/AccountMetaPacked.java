package com.vrforacle.domain;

/**
 * Account descriptor stored in a callback template.
 */
public record AccountMetaPacked(PublicKey pubkey, boolean isSigner, boolean isWritable) {
}
