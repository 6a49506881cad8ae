package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.envelope.DeadLetterRecord;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcHeaders;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.MessagingPublishException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Objects;

/**
 * Publishes every message the RPC layer sends: requests, responses, retries and
 * dead letters.
 *
 * <p>All messages are persistent JSON. Transient broker failures are retried a few
 * times with a fixed backoff; serialization failures are not. A message that still
 * cannot be sent raises {@link MessagingPublishException}.
 */
@Slf4j
public class RpcPublisher {

    static final String DEFAULT_EXCHANGE = "";

    private static final int MAX_RETRIES = 3;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    private final RabbitTemplate rabbitTemplate;
    private final RpcProperties properties;
    private final EnvelopeCodec codec;

    @Nullable
    private final MeterRegistry meterRegistry;

    public RpcPublisher(RabbitTemplate rabbitTemplate,
                        RpcProperties properties,
                        EnvelopeCodec codec,
                        @Nullable MeterRegistry meterRegistry) {
        this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.meterRegistry = meterRegistry;
    }

    // ========================================================================
    //   Client side
    // ========================================================================

    /**
     * Publish a request to the requests queue. The request id doubles as the AMQP
     * correlation id.
     */
    public void publishRequest(RpcRequest request, String replyTo) {
        Message message = MessageBuilder.withBody(codec.encodeRequest(request))
                .andProperties(jsonProperties())
                .setCorrelationId(request.id())
                .setReplyTo(replyTo)
                .build();
        send("request", properties.getExchange(), properties.getRequests().getRoutingKey(), message);
    }

    // ========================================================================
    //   Worker side
    // ========================================================================

    /**
     * Publish a response for an inbound request: to its reply-to queue through the
     * default exchange, or to the shared responses queue when it has none.
     */
    public void publishResponse(MessageProperties inbound, RpcResponse response) {
        String correlationId = StringUtils.hasText(inbound.getCorrelationId())
                ? inbound.getCorrelationId()
                : response.correlationId();

        Message message = MessageBuilder.withBody(codec.encodeResponse(response))
                .andProperties(jsonProperties())
                .setCorrelationId(correlationId)
                .build();

        String replyTo = inbound.getReplyTo();
        if (StringUtils.hasText(replyTo)) {
            send("response", DEFAULT_EXCHANGE, replyTo, message);
        } else {
            send("response", properties.getExchange(), properties.getResponses().getRoutingKey(), message);
        }
    }

    /**
     * Re-publish the original body to the retry queue, keeping correlation id and
     * reply-to.
     *
     * @param retryCount the new value of the retry counter header
     */
    public void publishRetry(byte[] body, MessageProperties inbound, int retryCount) {
        Message message = MessageBuilder.withBody(body)
                .andProperties(jsonProperties())
                .setCorrelationId(inbound.getCorrelationId())
                .setReplyTo(inbound.getReplyTo())
                .setHeader(RpcHeaders.RETRY_COUNT, retryCount)
                .build();
        send("retry", properties.getExchange(), properties.getRetry().getRoutingKey(), message);
    }

    public void publishDeadLetter(DeadLetterRecord record) {
        Message message = MessageBuilder.withBody(codec.encodeDeadLetter(record))
                .andProperties(jsonProperties())
                .setCorrelationId(record.correlationId())
                .build();
        send("dead-letter", properties.getExchange(), properties.getDeadLetter().getRoutingKey(), message);
    }

    // ========================================================================
    //   Sending
    // ========================================================================

    private static MessageProperties jsonProperties() {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding("UTF-8");
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        return props;
    }

    private void send(String target, String exchange, String routingKey, Message message) {
        try {
            retry(() -> rabbitTemplate.send(exchange, routingKey, message));
        } catch (RuntimeException ex) {
            if (meterRegistry != null) {
                meterRegistry.counter("rpc.publish.failure", "target", target).increment();
            }
            log.error("Failed to publish {} exchange='{}' routingKey={}", target, exchange, routingKey, ex);
            throw new MessagingPublishException("Failed to publish " + target, ex);
        }
    }

    private void retry(Runnable action) {
        int attempt = 1;

        while (true) {
            try {
                action.run();
                return;

            } catch (RuntimeException ex) {
                if (isNonTransient(ex) || attempt >= MAX_RETRIES) {
                    throw ex;
                }

                log.warn("Publish attempt {} failed. Retrying in {}ms",
                        attempt, RETRY_BACKOFF.toMillis(), ex);

                sleep(RETRY_BACKOFF);
                attempt++;
            }
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingPublishException("Interrupted while waiting to retry publish", e);
        }
    }

    private boolean isNonTransient(RuntimeException ex) {
        return ex instanceof IllegalArgumentException
                || (ex.getCause() instanceof java.nio.channels.UnresolvedAddressException);
    }
}
