package com.intteq.broker.rpc.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

public class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void decodesFullRequest() {
        RpcRequest request = codec.decodeRequest(utf8(
                "{\"id\":\"r-1\",\"version\":\"v1\",\"action\":\"create_task\","
                        + "\"data\":{\"title\":\"Buy milk\"},\"auth\":\"Bearer t\",\"extra\":1}"));

        Assertions.assertEquals("r-1", request.id());
        Assertions.assertEquals("v1.create_task", request.route());
        Assertions.assertEquals("Buy milk", request.data().get("title"));
        Assertions.assertEquals("Bearer t", request.auth());
    }

    @Test
    public void missingDataAndAuthDefaultToEmpty() {
        RpcRequest request = codec.decodeRequest(utf8("{\"id\":\"r-2\",\"version\":\"v1\",\"action\":\"health_check\"}"));

        Assertions.assertTrue(request.data().isEmpty());
        Assertions.assertEquals("", request.auth());
    }

    @Test
    public void invalidJsonHasNoRecoverableId() {
        MalformedEnvelopeException e = Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeRequest(utf8("{not json")));

        Assertions.assertTrue(e.getMessage().startsWith("Invalid JSON"));
        Assertions.assertNull(e.getRequestId());
    }

    @Test
    public void nonObjectBodyIsRejected() {
        MalformedEnvelopeException e = Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeRequest(utf8("[1,2,3]")));

        Assertions.assertEquals("Request envelope must be a JSON object", e.getMessage());
    }

    @Test
    public void missingFieldsKeepTheRecoveredId() {
        MalformedEnvelopeException e = Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeRequest(utf8("{\"id\":\"r-3\",\"version\":\"v1\"}")));

        Assertions.assertEquals("Missing required fields: id/version/action", e.getMessage());
        Assertions.assertEquals("r-3", e.getRequestId());
    }

    @Test
    public void nonObjectDataIsRejected() {
        MalformedEnvelopeException e = Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeRequest(utf8("{\"id\":\"r-4\",\"version\":\"v1\",\"action\":\"a\",\"data\":[1]}")));

        Assertions.assertEquals("Field 'data' must be a JSON object", e.getMessage());
        Assertions.assertEquals("r-4", e.getRequestId());
    }

    @Test
    public void overlongIdIsRejectedWithoutId() {
        String id = "x".repeat(EnvelopeCodec.MAX_ID_LENGTH + 1);
        MalformedEnvelopeException e = Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeRequest(utf8("{\"id\":\"" + id + "\",\"version\":\"v1\",\"action\":\"a\"}")));

        Assertions.assertNull(e.getRequestId());
    }

    @Test
    public void responseAlwaysCarriesBothDataAndError() throws Exception {
        JsonNode ok = new ObjectMapper().readTree(codec.encodeResponse(RpcResponse.ok("c-1", Map.of("status", "ok"))));
        JsonNode error = new ObjectMapper().readTree(codec.encodeResponse(RpcResponse.error("c-2", "Task not found")));

        Assertions.assertEquals("ok", ok.get("status").asText());
        Assertions.assertTrue(ok.has("error") && ok.get("error").isNull());
        Assertions.assertEquals("c-1", ok.get("correlation_id").asText());

        Assertions.assertEquals("error", error.get("status").asText());
        Assertions.assertTrue(error.has("data") && error.get("data").isNull());
        Assertions.assertEquals("Task not found", error.get("error").asText());
    }

    @Test
    public void decodesResponseFromText() {
        RpcResponse response = codec.decodeResponse(
                "{\"correlation_id\":\"c-3\",\"status\":\"error\",\"data\":null,\"error\":\"boom\"}");

        Assertions.assertEquals(ResponseStatus.ERROR, response.status());
        Assertions.assertFalse(response.isOk());
        Assertions.assertEquals("boom", response.error());
    }

    @Test
    public void responseWithoutStatusIsMalformed() {
        Assertions.assertThrows(MalformedEnvelopeException.class,
                () -> codec.decodeResponse("{\"correlation_id\":\"c-4\"}"));
    }

    @Test
    public void deadLetterKeepsUnparsableRequestAsText() throws Exception {
        DeadLetterRecord record = new DeadLetterRecord(
                Instant.parse("2025-01-01T00:00:00Z"),
                "Invalid JSON",
                codec.requestTree(utf8("{oops")),
                null,
                "amq.gen-1",
                0);

        JsonNode json = new ObjectMapper().readTree(codec.encodeDeadLetter(record));

        Assertions.assertEquals("2025-01-01T00:00:00Z", json.get("failed_at").asText());
        Assertions.assertEquals("{oops", json.get("request").asText());
        Assertions.assertEquals("amq.gen-1", json.get("reply_to").asText());
        Assertions.assertEquals(0, json.get("retry_count").asInt());
    }

    @Test
    public void retryCountHeaderToleratesJunk() {
        org.springframework.amqp.core.MessageProperties props = new org.springframework.amqp.core.MessageProperties();
        Assertions.assertEquals(0, RpcHeaders.retryCount(props));

        props.setHeader(RpcHeaders.RETRY_COUNT, 2L);
        Assertions.assertEquals(2, RpcHeaders.retryCount(props));

        props.setHeader(RpcHeaders.RETRY_COUNT, "three");
        Assertions.assertEquals(0, RpcHeaders.retryCount(props));
    }
}
