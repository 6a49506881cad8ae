package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.MessageContext;
import com.intteq.broker.rpc.dispatch.ActionDispatcher;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;
import com.intteq.broker.rpc.ledger.IdempotencyLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;

import java.util.Optional;

/**
 * Handles one delivery from the requests queue: decode, consult the ledger, dispatch,
 * settle.
 *
 * <p>Exceptions thrown by the ledger lookup, the dispatcher or a handler are classified
 * as transient faults and go through the bounded retry path. Only a failure to publish
 * or settle causes the delivery to be rejected with requeue, so the message is never
 * left unacknowledged.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestProcessor {

    private final EnvelopeCodec codec;
    private final IdempotencyLedger ledger;
    private final ActionDispatcher dispatcher;
    private final RetryPipeline pipeline;

    public DeliveryState process(Message message, MessageContext context) {
        InboundDelivery delivery = new InboundDelivery(message.getBody(), message.getMessageProperties(), context);
        try {
            return handle(delivery);
        } catch (RuntimeException ex) {
            if (context.isSettled()) {
                log.error("Failure after delivery {} was settled (correlationId={})",
                        context.deliveryTag(), delivery.correlationId(), ex);
                return DeliveryState.REQUEUED;
            }
            log.error("Could not process delivery {} (correlationId={}); requeueing",
                    context.deliveryTag(), delivery.correlationId(), ex);
            context.reject(true);
            return DeliveryState.REQUEUED;
        }
    }

    private DeliveryState handle(InboundDelivery delivery) {
        RpcRequest request;
        try {
            request = codec.decodeRequest(delivery.body());
        } catch (MalformedEnvelopeException e) {
            return pipeline.settle(delivery, null, Outcome.malformed(e));
        }

        Optional<RpcResponse> recorded;
        try {
            recorded = ledger.lookup(request.id());
        } catch (RuntimeException e) {
            log.warn("Ledger lookup failed for {}: {}", request.id(), e.getMessage());
            return pipeline.settle(delivery, request, Outcome.transientFault(e));
        }
        if (recorded.isPresent()) {
            return pipeline.replay(delivery, request, recorded.get());
        }

        Outcome outcome;
        try {
            outcome = Outcome.of(dispatcher.dispatch(request));
        } catch (RuntimeException e) {
            outcome = Outcome.transientFault(e);
        }
        return pipeline.settle(delivery, request, outcome);
    }
}
