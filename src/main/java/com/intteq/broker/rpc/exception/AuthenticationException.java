package com.intteq.broker.rpc.exception;

/**
 * The credential attached to a request is missing, invalid or expired, or does not
 * resolve to a known principal. The message is returned to the caller verbatim.
 */
public class AuthenticationException extends RpcException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
