package com.intteq.broker.rpc.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Application-level status of a {@link RpcResponse}.
 */
public enum ResponseStatus {
    OK("ok"),
    ERROR("error");

    private final String wireValue;

    ResponseStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ResponseStatus fromWire(String value) {
        for (ResponseStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown response status: " + value);
    }
}
