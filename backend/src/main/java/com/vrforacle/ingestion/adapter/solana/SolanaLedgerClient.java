package com.vrforacle.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vrforacle.domain.PublicKey;
import com.vrforacle.ingestion.adapter.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed ledger queries and transaction submission over {@link SolanaRpcClient}.
 * Calls block the calling thread; every call first takes a permit from the shared RPC rate limiter.
 * Transport failures raise {@link RpcException}, JSON-RPC errors {@link SolanaRpcErrorException}.
 */
@Slf4j
public class SolanaLedgerClient {

    /** Max signatures per getSignaturesForAddress call (RPC limit 1-1000). */
    public static final int MAX_SIGNATURES_LIMIT = 1000;

    private final SolanaRpcClient rpcClient;
    private final String endpoint;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SolanaLedgerClient(SolanaRpcClient rpcClient, String endpoint, RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.endpoint = endpoint;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    /**
     * Raw account bytes, empty if the account does not exist.
     */
    public Optional<byte[]> getAccountData(PublicKey address, Commitment commitment) {
        JsonNode value = call("getAccountInfo", List.of(address.toBase58(),
                Map.of("encoding", "base64", "commitment", commitment.value()))).path("value");
        if (value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode data = value.path("data");
        String encoded = data.isArray() ? data.path(0).asText("") : data.asText("");
        try {
            return Optional.of(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
            throw new RpcException("getAccountInfo returned undecodable data for " + address, e);
        }
    }

    public LatestBlockhash getLatestBlockhash(Commitment commitment) {
        JsonNode value = call("getLatestBlockhash", List.of(Map.of("commitment", commitment.value()))).path("value");
        String blockhash = value.path("blockhash").asText(null);
        if (blockhash == null) {
            throw new RpcException("getLatestBlockhash returned no blockhash");
        }
        return new LatestBlockhash(blockhash, value.path("lastValidBlockHeight").asLong());
    }

    public long getBlockHeight(Commitment commitment) {
        return call("getBlockHeight", List.of(Map.of("commitment", commitment.value()))).asLong();
    }

    /**
     * One page of signatures for {@code address}, newest first, strictly older than {@code before} when given.
     */
    public List<SignatureInfo> getSignaturesForAddress(PublicKey address, String before, int limit, Commitment commitment) {
        Map<String, Object> config = new HashMap<>();
        config.put("limit", Math.min(Math.max(1, limit), MAX_SIGNATURES_LIMIT));
        config.put("commitment", commitment.value());
        if (before != null) {
            config.put("before", before);
        }
        JsonNode result = call("getSignaturesForAddress", List.of(address.toBase58(), config));
        List<SignatureInfo> list = new ArrayList<>();
        for (JsonNode info : result) {
            JsonNode err = info.path("err");
            list.add(new SignatureInfo(
                    info.path("signature").asText(),
                    info.path("slot").asLong(),
                    !err.isNull() && !err.isMissingNode()));
        }
        return list;
    }

    /**
     * Outcome and log lines of a transaction, empty if the node does not know it or recorded no logs.
     */
    public Optional<TransactionLogs> getTransactionLogs(String signature, Commitment commitment) {
        JsonNode result = call("getTransaction", List.of(signature, Map.of(
                "encoding", "json",
                "commitment", commitment.value(),
                "maxSupportedTransactionVersion", 0)));
        JsonNode meta = result.path("meta");
        if (result.isNull() || meta.isMissingNode() || meta.isNull() || !meta.path("logMessages").isArray()) {
            return Optional.empty();
        }
        List<String> logs = new ArrayList<>();
        meta.path("logMessages").forEach(l -> logs.add(l.asText()));
        JsonNode err = meta.path("err");
        return Optional.of(new TransactionLogs(signature, !err.isNull() && !err.isMissingNode(), logs));
    }

    /**
     * Submits a signed, base64-encoded transaction and returns its signature.
     */
    public String sendTransaction(String base64Transaction, boolean skipPreflight, Commitment preflightCommitment) {
        return call("sendTransaction", List.of(base64Transaction, Map.of(
                "encoding", "base64",
                "skipPreflight", skipPreflight,
                "preflightCommitment", preflightCommitment.value()))).asText();
    }

    public Optional<SignatureStatus> getSignatureStatus(String signature) {
        JsonNode status = call("getSignatureStatuses", List.of(List.of(signature),
                Map.of("searchTransactionHistory", false))).path("value").path(0);
        if (status.isNull() || status.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(new SignatureStatus(
                status.path("slot").asLong(),
                status.path("confirmationStatus").asText(null),
                SolanaRpcErrorException.transactionErrorName(status.path("err")).orElse(null)));
    }

    private JsonNode call(String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned malformed JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            log.debug("{} error: {}", method, error);
            throw new SolanaRpcErrorException(method, error.path("code").asInt(), error.path("message").asText(""),
                    error.has("data") ? error.get("data") : null);
        }
        return root.path("result");
    }
}
