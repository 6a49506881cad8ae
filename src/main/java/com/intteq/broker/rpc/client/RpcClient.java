package com.intteq.broker.rpc.client;

import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.RpcException;
import com.intteq.broker.rpc.exception.RpcTimeoutException;
import com.intteq.broker.rpc.internal.RpcPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client side of the RPC protocol.
 *
 * <p>Each call publishes a request whose id is also its correlation id, naming this
 * client's exclusive reply queue as reply-to, and blocks until the matching response
 * arrives or the timeout elapses. Replies are delivered to {@link #onReply(Message)}
 * by a listener on the reply queue.
 *
 * <p>Usage:
 * <pre>
 *   RpcResponse health = client.call("v1", "health_check", Map.of(), "");
 *
 *   // idempotent retry: the same request id yields the same response
 *   client.call("v1", "create_task", data, token, Duration.ofSeconds(10), "order-42");
 *   client.call("v1", "create_task", data, token, Duration.ofSeconds(10), "order-42");
 * </pre>
 *
 * <p>A timeout raises {@link RpcTimeoutException}: the request may still be executed,
 * and repeating the call with the same id is the safe way to find out.
 */
@Slf4j
public class RpcClient {

    private final RpcPublisher publisher;
    private final EnvelopeCodec codec;
    private final String replyQueue;
    private final Duration defaultTimeout;

    @Nullable
    private final MeterRegistry meterRegistry;

    /** Calls waiting for a reply, keyed by correlation id. */
    private final Map<String, CompletableFuture<RpcResponse>> pending = new ConcurrentHashMap<>();

    public RpcClient(RpcPublisher publisher,
                     EnvelopeCodec codec,
                     String replyQueue,
                     Duration defaultTimeout,
                     @Nullable MeterRegistry meterRegistry) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.replyQueue = Objects.requireNonNull(replyQueue, "replyQueue must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        this.meterRegistry = meterRegistry;
    }

    // ========================================================================
    //   Calls
    // ========================================================================

    public RpcResponse call(String version, String action, Map<String, Object> data, String auth) {
        return call(version, action, data, auth, defaultTimeout, null);
    }

    public RpcResponse call(String version, String action, Map<String, Object> data, String auth,
                            Duration timeout) {
        return call(version, action, data, auth, timeout, null);
    }

    /**
     * Send a request and wait for its response.
     *
     * @param requestId id to use, or null to generate one. Reusing the id of an earlier
     *                  call asks the worker to replay that call's response.
     * @return the response, whatever its status
     * @throws RpcTimeoutException        if no response arrives within {@code timeout}
     * @throws IllegalStateException      if a call with the same id is already waiting
     * @throws com.intteq.broker.rpc.exception.MessagingPublishException if the request could not be published
     */
    public RpcResponse call(String version, String action, Map<String, Object> data, String auth,
                            Duration timeout, @Nullable String requestId) {
        String id = StringUtils.hasText(requestId) ? requestId : UUID.randomUUID().toString();
        RpcRequest request = new RpcRequest(id, version, action, data, auth);

        CompletableFuture<RpcResponse> future = new CompletableFuture<>();
        if (pending.putIfAbsent(id, future) != null) {
            throw new IllegalStateException("A call with request id " + id + " is already in flight");
        }

        try {
            publisher.publishRequest(request, replyQueue);
            log.debug("Sent request {} {} (replyTo={})", id, request.route(), replyQueue);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            if (meterRegistry != null) {
                meterRegistry.counter("rpc.client.timeout", "action", request.route()).increment();
            }
            log.warn("Request {} {} timed out after {}ms", id, request.route(), timeout.toMillis());
            throw new RpcTimeoutException(id, timeout);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while waiting for response to " + id, e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RpcException("Call " + id + " failed", cause);

        } finally {
            pending.remove(id, future);
        }
    }

    // ========================================================================
    //   Replies
    // ========================================================================

    /**
     * Complete the call waiting for this reply. Replies nobody waits for (late
     * arrivals after a timeout) are dropped.
     */
    public void onReply(Message message) {
        String correlationId = message.getMessageProperties().getCorrelationId();

        RpcResponse response;
        try {
            response = codec.decodeResponse(message.getBody());
        } catch (RuntimeException e) {
            CompletableFuture<RpcResponse> waiting = correlationId != null ? pending.get(correlationId) : null;
            if (waiting != null) {
                waiting.completeExceptionally(e);
            } else {
                log.warn("Dropping undecodable reply (correlationId={}): {}", correlationId, e.getMessage());
            }
            return;
        }

        String key = StringUtils.hasText(correlationId) ? correlationId : response.correlationId();
        CompletableFuture<RpcResponse> waiting = key != null ? pending.get(key) : null;
        if (waiting == null) {
            log.debug("No call waiting for reply {}; dropping it", key);
            return;
        }
        waiting.complete(response);
    }

    public String getReplyQueue() {
        return replyQueue;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    int pendingCount() {
        return pending.size();
    }
}
