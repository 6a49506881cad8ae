package com.intteq.broker.rpc.exception;

/**
 * Base type of the unchecked exceptions raised by the RPC layer.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
