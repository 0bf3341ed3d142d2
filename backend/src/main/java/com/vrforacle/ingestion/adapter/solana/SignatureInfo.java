package com.vrforacle.ingestion.adapter.solana;

/**
 * One entry of a historical signature listing.
 */
public record SignatureInfo(String signature, long slot, boolean failed) {
}
