package com.intteq.broker.rpc;

import com.rabbitmq.client.Channel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settlement handle for a single RabbitMQ delivery consumed with manual acknowledgement.
 *
 * <p>Usage:
 * <pre>
 *   MessageContext ctx = MessageContext.forRabbitMQ(channel, deliveryTag);
 *   ctx.ack();            // processed (successfully or not), remove from the queue
 *   ctx.reject(true);     // give it back to the broker for redelivery
 * </pre>
 *
 * <p>A delivery is settled exactly once. Under prefetch=1 an unsettled delivery
 * blocks the consumer, and a second settlement of the same tag closes the channel
 * with PRECONDITION_FAILED, so both are treated as programming errors.
 *
 * <p>Channel I/O failures are wrapped in {@link MessagingOperationException}.
 */
@Getter
@Accessors(fluent = true)
@Slf4j
public class MessageContext {

    private final Channel channel;
    private final long deliveryTag;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean settled = new AtomicBoolean(false);

    /**
     * Create a context for RabbitMQ manual-ack processing.
     *
     * @param channel     RabbitMQ channel (must not be null)
     * @param deliveryTag delivery tag from the envelope
     * @return a new {@link MessageContext}
     */
    public static MessageContext forRabbitMQ(Channel channel, long deliveryTag) {
        Objects.requireNonNull(channel, "channel must not be null");
        return new MessageContext(channel, deliveryTag);
    }

    private MessageContext(Channel channel, long deliveryTag) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * Acknowledge the delivery.
     *
     * @throws IllegalStateException       if the delivery was already settled
     * @throws MessagingOperationException if the channel call fails
     */
    public void ack() {
        markSettled("ack");
        try {
            channel.basicAck(deliveryTag, false);
            log.debug("RabbitMQ ack successful (tag={})", deliveryTag);
        } catch (Exception e) {
            log.error("Failed to ack message (tag={})", deliveryTag, e);
            throw new MessagingOperationException("Failed to ack message", e);
        }
    }

    /**
     * Negative-acknowledge the delivery.
     *
     * @param requeue {@code true} to have the broker redeliver it, {@code false} to drop
     *                it (or route it to the queue's dead-letter exchange, if any)
     * @throws IllegalStateException       if the delivery was already settled
     * @throws MessagingOperationException if the channel call fails
     */
    public void reject(boolean requeue) {
        markSettled("reject");
        try {
            channel.basicNack(deliveryTag, false, requeue);
            log.debug("RabbitMQ nack issued (tag={}, requeue={})", deliveryTag, requeue);
        } catch (Exception e) {
            log.error("Failed to nack message (tag={})", deliveryTag, e);
            throw new MessagingOperationException("Failed to nack message", e);
        }
    }

    private void markSettled(String operation) {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException(
                    "Delivery " + deliveryTag + " already settled; refusing to " + operation + " it again");
        }
    }

    /**
     * Runtime exception used by {@link MessageContext} to wrap channel I/O exceptions.
     */
    public static class MessagingOperationException extends RuntimeException {
        public MessagingOperationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
