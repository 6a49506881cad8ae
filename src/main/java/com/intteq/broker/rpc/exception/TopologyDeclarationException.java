package com.intteq.broker.rpc.exception;

/**
 * The broker refused a declaration, typically because an exchange or queue already
 * exists with different arguments. This is a configuration error and is fatal.
 */
public class TopologyDeclarationException extends RpcException {

    public TopologyDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
