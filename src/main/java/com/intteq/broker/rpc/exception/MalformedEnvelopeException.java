package com.intteq.broker.rpc.exception;

import org.springframework.lang.Nullable;

/**
 * A message body that is not a usable request or response envelope: invalid JSON,
 * wrong shape, or missing required fields.
 *
 * <p>Malformed input is a permanent failure and is never retried. When the request id
 * could still be read from the body it is carried here so the caller can be answered
 * under it.
 */
public class MalformedEnvelopeException extends RpcException {

    @Nullable
    private final String requestId;

    public MalformedEnvelopeException(String message, @Nullable String requestId) {
        super(message);
        this.requestId = requestId;
    }

    public MalformedEnvelopeException(String message, @Nullable String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    @Nullable
    public String getRequestId() {
        return requestId;
    }
}
