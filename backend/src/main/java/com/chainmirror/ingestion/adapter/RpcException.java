package com.chainmirror.ingestion.adapter;

/**
 * Thrown when a chain RPC call fails (HTTP, timeout, JSON-RPC error or unusable result).
 * Transient: the cycle that hit it ends and the next scheduled cycle starts over.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
