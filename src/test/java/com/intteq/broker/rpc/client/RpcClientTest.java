package com.intteq.broker.rpc.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;
import com.intteq.broker.rpc.exception.RpcTimeoutException;
import com.intteq.broker.rpc.internal.RpcPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

@ExtendWith(MockitoExtension.class)
public class RpcClientTest {

    private static final String REPLY_QUEUE = "amq.gen-client";

    @Mock
    private RpcPublisher publisher;

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private RpcClient client;

    @BeforeEach
    public void setUp() {
        client = new RpcClient(publisher, codec, REPLY_QUEUE, Duration.ofSeconds(5), meterRegistry);
    }

    private Message reply(String correlationId, RpcResponse response) {
        MessageProperties props = new MessageProperties();
        props.setCorrelationId(correlationId);
        return new Message(codec.encodeResponse(response), props);
    }

    /** Answers every published request from the worker's side, on the publishing thread. */
    private void answerWith(RpcResponse template) {
        doAnswer(invocation -> {
            RpcRequest request = invocation.getArgument(0);
            client.onReply(reply(request.id(),
                    new RpcResponse(request.id(), template.status(), template.data(), template.error())));
            return null;
        }).when(publisher).publishRequest(any(RpcRequest.class), eq(REPLY_QUEUE));
    }

    @Test
    public void returnsMatchingResponse() {
        answerWith(RpcResponse.ok("ignored", Map.of("status", "ok")));

        RpcResponse response = client.call("v1", "health_check", Map.of(), "");

        Assertions.assertTrue(response.isOk());
        Assertions.assertEquals(Map.of("status", "ok"), response.data());
        Assertions.assertEquals(0, client.pendingCount());
    }

    @Test
    public void generatesIdWhenNoneGiven() {
        answerWith(RpcResponse.ok("ignored", null));

        client.call("v1", "health_check", Map.of(), "");

        ArgumentCaptor<RpcRequest> captor = ArgumentCaptor.forClass(RpcRequest.class);
        verify(publisher).publishRequest(captor.capture(), eq(REPLY_QUEUE));
        Assertions.assertFalse(captor.getValue().id().isBlank());
    }

    @Test
    public void usesGivenRequestId() {
        answerWith(RpcResponse.error("ignored", "Task not found"));

        RpcResponse response = client.call("v1", "get_task", Map.of("task_id", 9), "t",
                Duration.ofSeconds(1), "IDEMPOTENCY-DEMO-123");

        Assertions.assertEquals("IDEMPOTENCY-DEMO-123", response.correlationId());
        Assertions.assertEquals("Task not found", response.error());
    }

    @Test
    public void timesOutWithUnknownOutcome() {
        RpcTimeoutException e = Assertions.assertThrows(RpcTimeoutException.class,
                () -> client.call("v1", "health_check", Map.of(), "", Duration.ofMillis(50), "slow-1"));

        Assertions.assertEquals("slow-1", e.getRequestId());
        Assertions.assertEquals(0, client.pendingCount());
        Assertions.assertEquals(1.0,
                meterRegistry.counter("rpc.client.timeout", "action", "v1.health_check").count());
    }

    @Test
    public void lateAndForeignRepliesAreDropped() {
        client.onReply(reply("nobody-waits", RpcResponse.ok("nobody-waits", null)));

        Assertions.assertEquals(0, client.pendingCount());
    }

    @Test
    public void undecodableReplyFailsTheWaitingCall() {
        doAnswer(invocation -> {
            RpcRequest request = invocation.getArgument(0);
            MessageProperties props = new MessageProperties();
            props.setCorrelationId(request.id());
            client.onReply(new Message("garbage".getBytes(StandardCharsets.UTF_8), props));
            return null;
        }).when(publisher).publishRequest(any(RpcRequest.class), eq(REPLY_QUEUE));

        Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> client.call("v1", "health_check", Map.of(), ""));
    }
}
