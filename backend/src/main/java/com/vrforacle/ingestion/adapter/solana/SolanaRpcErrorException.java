package com.vrforacle.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.vrforacle.ingestion.adapter.RpcException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * JSON-RPC {@code error} object returned by a ledger node.
 */
@Getter
public class SolanaRpcErrorException extends RpcException {

    /** Preflight simulation of a sent transaction failed; {@code data} is the simulation result. */
    public static final int SEND_TRANSACTION_PREFLIGHT_FAILURE = -32002;
    public static final int BLOCK_NOT_AVAILABLE = -32004;
    public static final int NODE_UNHEALTHY = -32005;
    public static final int MIN_CONTEXT_SLOT_NOT_REACHED = -32016;

    private final int code;
    private final String rpcMessage;
    private final transient JsonNode data;

    public SolanaRpcErrorException(String method, int code, String rpcMessage, JsonNode data) {
        super(method + " error " + code + ": " + rpcMessage);
        this.code = code;
        this.rpcMessage = rpcMessage;
        this.data = data;
    }

    public boolean isPreflightFailure() {
        return code == SEND_TRANSACTION_PREFLIGHT_FAILURE;
    }

    /** Node-side conditions that clear up by themselves. */
    public boolean isNodeTransient() {
        return code == NODE_UNHEALTHY || code == BLOCK_NOT_AVAILABLE || code == MIN_CONTEXT_SLOT_NOT_REACHED;
    }

    /**
     * Name of the transaction error in {@code data.err}: the string itself ({@code "BlockhashNotFound"})
     * or the variant key of an object ({@code {"InstructionError":[0,...]}}).
     */
    public Optional<String> getTransactionErrorName() {
        return data == null ? Optional.empty() : transactionErrorName(data.path("err"));
    }

    /** Simulated log lines, present when the simulation executed. */
    public Optional<List<String>> getSimulationLogs() {
        if (data == null || !data.path("logs").isArray()) {
            return Optional.empty();
        }
        List<String> logs = new ArrayList<>();
        data.path("logs").forEach(l -> logs.add(l.asText()));
        return Optional.of(logs);
    }

    static Optional<String> transactionErrorName(JsonNode err) {
        if (err == null || err.isNull() || err.isMissingNode()) {
            return Optional.empty();
        }
        if (err.isTextual()) {
            return Optional.of(err.asText());
        }
        Iterator<String> names = err.fieldNames();
        return names.hasNext() ? Optional.of(names.next()) : Optional.of(err.toString());
    }
}
