package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.MessageContext;
import org.springframework.amqp.core.MessageProperties;

/**
 * A delivery from the requests queue together with its settlement handle.
 */
public record InboundDelivery(byte[] body, MessageProperties properties, MessageContext context) {

    public String correlationId() {
        return properties.getCorrelationId();
    }

    public String replyTo() {
        return properties.getReplyTo();
    }
}
