package com.vaultledger.chain;

/**
 * Thrown when a JSON-RPC call fails (HTTP error, JSON-RPC error object, empty or undecodable result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
