package com.lpradar.chain;

/**
 * Thrown when a JSON-RPC call fails (HTTP, JSON-RPC error, or retries exhausted).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
