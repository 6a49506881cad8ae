package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;
import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * Result of executing one delivery, before it is settled.
 *
 * @param kind     classification driving the settlement
 * @param response the dispatcher's response, set for {@link Kind#SUCCESS} and
 *                 {@link Kind#BUSINESS_ERROR}
 * @param fault    the failure, set for {@link Kind#TRANSIENT_FAULT} and {@link Kind#MALFORMED}
 */
public record Outcome(Kind kind, @Nullable RpcResponse response, @Nullable Exception fault) {

    public enum Kind {
        /** The handler produced a payload. */
        SUCCESS,
        /** The request was rejected or the handler reported an error. Permanent. */
        BUSINESS_ERROR,
        /** Something threw while executing. Retried. */
        TRANSIENT_FAULT,
        /** The body is not a usable request envelope. Permanent. */
        MALFORMED
    }

    public Outcome {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static Outcome of(RpcResponse response) {
        Objects.requireNonNull(response, "response must not be null");
        return new Outcome(response.isOk() ? Kind.SUCCESS : Kind.BUSINESS_ERROR, response, null);
    }

    public static Outcome transientFault(Exception fault) {
        return new Outcome(Kind.TRANSIENT_FAULT, null, Objects.requireNonNull(fault, "fault must not be null"));
    }

    public static Outcome malformed(MalformedEnvelopeException fault) {
        return new Outcome(Kind.MALFORMED, null, Objects.requireNonNull(fault, "fault must not be null"));
    }
}
