package com.vrforacle.ingestion.adapter.solana;

/**
 * Recent blockhash (base58) and the last block height at which transactions referencing it are accepted.
 */
public record LatestBlockhash(String blockhash, long lastValidBlockHeight) {
}
