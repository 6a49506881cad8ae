package com.intteq.broker.rpc.internal;

/**
 * Terminal state a delivery reached. Every state except {@link #REQUEUED} means the
 * delivery was acknowledged after exactly one response (or retry publication) was sent.
 */
public enum DeliveryState {

    /** A recorded response was republished. */
    REPLAYED,

    /** The action succeeded. */
    COMPLETED,

    /** Business or authentication error. */
    PERMANENT_FAILURE,

    /** Transient fault; the request went to the retry queue. */
    RETRY_SCHEDULED,

    /** Transient fault with no retries left; dead-lettered. */
    RETRIES_EXHAUSTED,

    /** Undecodable body; dead-lettered. */
    BAD_REQUEST,

    /** Settlement itself failed; the delivery was handed back to the broker. */
    REQUEUED
}
