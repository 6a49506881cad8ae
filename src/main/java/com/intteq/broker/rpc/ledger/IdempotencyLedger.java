package com.intteq.broker.rpc.ledger;

import com.intteq.broker.rpc.envelope.RpcResponse;

import java.util.Optional;

/**
 * Persisted mapping from request id to the response of its terminal outcome.
 *
 * <p>Records are written once and never updated or deleted. Concurrent workers that
 * race on the same id are resolved by the insert-if-absent semantics of
 * {@link #record(String, RpcResponse)}.
 */
public interface IdempotencyLedger {

    /**
     * @return the response recorded for {@code id}, if any
     */
    Optional<RpcResponse> lookup(String id);

    /**
     * Record the response for {@code id} unless one already exists.
     *
     * @return {@code true} if this call inserted the record, {@code false} if a
     * record was already present (it is left untouched)
     */
    boolean record(String id, RpcResponse response);
}
