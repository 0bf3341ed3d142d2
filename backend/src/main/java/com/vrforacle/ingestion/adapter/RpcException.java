package com.vrforacle.ingestion.adapter;

/**
 * Thrown when a ledger RPC call fails at the transport level (connection, timeout, HTTP status).
 * Such failures are transient: the same call may succeed later.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
