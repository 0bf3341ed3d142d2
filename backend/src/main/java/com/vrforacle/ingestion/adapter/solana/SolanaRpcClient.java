package com.vrforacle.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Raw ledger JSON-RPC transport; returns the response body. Typed calls live in {@link SolanaLedgerClient}.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
