package com.intteq.broker.rpc.exception;

import java.time.Duration;

/**
 * No response arrived for a call within its timeout.
 *
 * <p>The outcome of the request is unknown: a worker may still process it later.
 * Callers retry safely by repeating the call with the same {@link #getRequestId()}.
 */
public class RpcTimeoutException extends RpcException {

    private final String requestId;
    private final Duration timeout;

    public RpcTimeoutException(String requestId, Duration timeout) {
        super("No response for request " + requestId + " within " + timeout.toMillis() + "ms");
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
