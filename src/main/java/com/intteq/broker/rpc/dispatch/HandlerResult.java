package com.intteq.broker.rpc.dispatch;

import com.intteq.broker.rpc.envelope.ResponseStatus;
import com.intteq.broker.rpc.envelope.RpcResponse;

/**
 * What a handler reports back: a payload, or a business error message.
 *
 * <p>Business errors are permanent. A handler signals a transient failure by throwing.
 */
public record HandlerResult(ResponseStatus status, Object data, String error) {

    public static HandlerResult ok(Object data) {
        return new HandlerResult(ResponseStatus.OK, data, null);
    }

    public static HandlerResult error(String message) {
        return new HandlerResult(ResponseStatus.ERROR, null, message);
    }

    public RpcResponse toResponse(String correlationId) {
        return status == ResponseStatus.OK
                ? RpcResponse.ok(correlationId, data)
                : RpcResponse.error(correlationId, error);
    }
}
