package com.intteq.broker.rpc.exception;

/**
 * Exception thrown when a request, response, retry or dead-letter message could not
 * be handed to the broker after retry attempts.
 */
public class MessagingPublishException extends RpcException {

    public MessagingPublishException(String message) {
        super(message);
    }

    public MessagingPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
