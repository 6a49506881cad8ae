package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.envelope.DeadLetterRecord;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcHeaders;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;
import com.intteq.broker.rpc.ledger.IdempotencyLedger;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Settles a delivery according to its {@link Outcome}.
 *
 * <p>Terminal outcomes are recorded in the ledger before the response is published,
 * and the delivery is acknowledged last. If the worker dies in between, the
 * redelivered request is answered from the ledger instead of being executed again.
 *
 * <p>When the ledger already holds a response for the id (another worker got there
 * first), that response is published instead of the local one so that every reply for
 * an id is identical.
 *
 * <p>A ledger that cannot record is logged and the response is published anyway. The
 * delivery is still acked, so a failing store cannot keep a request cycling.
 */
@Slf4j
public class RetryPipeline {

    static final String EXHAUSTED_PREFIX = "retries exhausted: ";

    private final IdempotencyLedger ledger;
    private final RpcPublisher publisher;
    private final EnvelopeCodec codec;
    private final RpcProperties properties;
    private final Clock clock;

    @Nullable
    private final MeterRegistry meterRegistry;

    public RetryPipeline(IdempotencyLedger ledger,
                         RpcPublisher publisher,
                         EnvelopeCodec codec,
                         RpcProperties properties,
                         Clock clock,
                         @Nullable MeterRegistry meterRegistry) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.meterRegistry = meterRegistry;
    }

    /**
     * Answer a request whose id is already in the ledger.
     */
    public DeliveryState replay(InboundDelivery delivery, RpcRequest request, RpcResponse recorded) {
        publisher.publishResponse(delivery.properties(), recorded);
        delivery.context().ack();
        log.info("replayed: {} {}", request.id(), request.route());
        return count(DeliveryState.REPLAYED);
    }

    /**
     * Settle a delivery that was executed (or could not be decoded).
     *
     * @param request the decoded request, null only for {@link Outcome.Kind#MALFORMED}
     */
    public DeliveryState settle(InboundDelivery delivery, @Nullable RpcRequest request, Outcome outcome) {
        return switch (outcome.kind()) {
            case SUCCESS -> completed(delivery, request, outcome.response());
            case BUSINESS_ERROR -> failed(delivery, request, outcome.response());
            case TRANSIENT_FAULT -> retryOrExhaust(delivery, request, outcome.fault());
            case MALFORMED -> badRequest(delivery, (MalformedEnvelopeException) outcome.fault());
        };
    }

    // ========================================================================
    //   Outcomes
    // ========================================================================

    private DeliveryState completed(InboundDelivery delivery, RpcRequest request, RpcResponse response) {
        respond(delivery, request.id(), response);
        delivery.context().ack();
        log.info("ok: {} {}", request.id(), request.route());
        return count(DeliveryState.COMPLETED);
    }

    private DeliveryState failed(InboundDelivery delivery, RpcRequest request, RpcResponse response) {
        RpcResponse answer = record(request.id(), response);
        if (properties.isDeadLetterBusinessErrors()) {
            deadLetter(delivery, response.error());
        }
        publisher.publishResponse(delivery.properties(), answer);
        delivery.context().ack();
        log.error("failed: {} {} error={}", request.id(), request.route(), response.error());
        return count(DeliveryState.PERMANENT_FAILURE);
    }

    private DeliveryState retryOrExhaust(InboundDelivery delivery, RpcRequest request, Exception fault) {
        int retryCount = RpcHeaders.retryCount(delivery.properties());

        if (retryCount < properties.getMaxRetries()) {
            int next = retryCount + 1;
            publisher.publishRetry(delivery.body(), delivery.properties(), next);
            delivery.context().ack();
            log.warn("retry #{} for {} because {}", next, request.id(), describe(fault));
            return count(DeliveryState.RETRY_SCHEDULED);
        }

        String reason = EXHAUSTED_PREFIX + describe(fault);
        RpcResponse answer = record(request.id(), RpcResponse.error(request.id(), reason));
        deadLetter(delivery, reason);
        publisher.publishResponse(delivery.properties(), answer);
        delivery.context().ack();
        log.error("dead-lettered: {} err={}", request.id(), describe(fault), fault);
        return count(DeliveryState.RETRIES_EXHAUSTED);
    }

    private DeliveryState badRequest(InboundDelivery delivery, MalformedEnvelopeException fault) {
        String id = fault.getRequestId();
        RpcResponse answer = id != null
                ? record(id, RpcResponse.error(id, fault.getMessage()))
                : RpcResponse.error(RpcHeaders.UNKNOWN_ID, fault.getMessage());
        deadLetter(delivery, fault.getMessage());
        publisher.publishResponse(delivery.properties(), answer);
        delivery.context().ack();
        log.error("bad-request: {} err={}", id != null ? id : RpcHeaders.UNKNOWN_ID, fault.getMessage());
        return count(DeliveryState.BAD_REQUEST);
    }

    // ========================================================================
    //   Helpers
    // ========================================================================

    /**
     * Record, then publish whatever the ledger holds for the id.
     */
    private void respond(InboundDelivery delivery, String id, RpcResponse response) {
        publisher.publishResponse(delivery.properties(), record(id, response));
    }

    /**
     * @return the response to publish for the id: the recorded one, or {@code response}
     *         when the ledger could not be written
     */
    private RpcResponse record(String id, RpcResponse response) {
        try {
            if (ledger.record(id, response)) {
                return response;
            }
            return ledger.lookup(id).orElse(response);
        } catch (RuntimeException e) {
            log.error("Could not record response for {}; publishing it unrecorded", id, e);
            return response;
        }
    }

    private void deadLetter(InboundDelivery delivery, String reason) {
        publisher.publishDeadLetter(new DeadLetterRecord(
                Instant.now(clock),
                reason,
                codec.requestTree(delivery.body()),
                delivery.correlationId(),
                delivery.replyTo(),
                RpcHeaders.retryCount(delivery.properties())
        ));
    }

    private static String describe(Exception fault) {
        return fault.getMessage() != null ? fault.getMessage() : fault.getClass().getSimpleName();
    }

    private DeliveryState count(DeliveryState state) {
        if (meterRegistry != null) {
            meterRegistry.counter("rpc.worker.outcome", "outcome", state.name().toLowerCase()).increment();
        }
        return state;
    }
}
