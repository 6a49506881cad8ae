package com.intteq.broker.rpc.envelope;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response envelope returned by a worker.
 *
 * <p>Exactly one of {@code data} and {@code error} is set, selected by {@code status}.
 * Both keys are always present on the wire.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"correlation_id", "status", "data", "error"})
public record RpcResponse(
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("status") ResponseStatus status,
        @JsonProperty("data") Object data,
        @JsonProperty("error") String error
) {

    public static RpcResponse ok(String correlationId, Object data) {
        return new RpcResponse(correlationId, ResponseStatus.OK, data, null);
    }

    public static RpcResponse error(String correlationId, String error) {
        return new RpcResponse(correlationId, ResponseStatus.ERROR, null, error);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == ResponseStatus.OK;
    }
}
