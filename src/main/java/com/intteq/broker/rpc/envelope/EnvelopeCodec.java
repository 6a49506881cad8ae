package com.intteq.broker.rpc.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intteq.broker.rpc.exception.MalformedEnvelopeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 JSON codec for the request, response and dead-letter bodies.
 *
 * <p>Works on a private copy of the application's {@link ObjectMapper} so that wire
 * settings (ISO timestamps, tolerance of unknown fields) do not leak into it.
 */
public class EnvelopeCodec {

    /** Width of the ledger key column. Longer ids cannot be recorded. */
    public static final int MAX_ID_LENGTH = 64;

    private static final String MISSING_FIELDS = "Missing required fields: id/version/action";

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ========================================================================
    //   Requests
    // ========================================================================

    /**
     * Decode and validate a request body.
     *
     * @throws MalformedEnvelopeException if the body is not JSON, not an object, has a
     *                                    non-object {@code data}, or lacks id/version/action
     */
    public RpcRequest decodeRequest(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Invalid JSON: " + e.getMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Request envelope must be a JSON object", null);
        }

        String id = recoverId(root);

        JsonNode data = root.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            throw new MalformedEnvelopeException("Field 'data' must be a JSON object", id);
        }

        RpcRequest request;
        try {
            request = objectMapper.treeToValue(root, RpcRequest.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Invalid request envelope: " + e.getOriginalMessage(), id, e);
        }

        if (isBlank(request.id()) || isBlank(request.version()) || isBlank(request.action())) {
            throw new MalformedEnvelopeException(MISSING_FIELDS, id);
        }
        if (id == null) {
            throw new MalformedEnvelopeException(
                    "Field 'id' must not exceed " + MAX_ID_LENGTH + " characters", null);
        }
        return request;
    }

    public byte[] encodeRequest(RpcRequest request) {
        return encode(request);
    }

    /**
     * Best-effort view of a request body for the dead-letter queue: the parsed JSON
     * tree, or the raw text when it does not parse.
     */
    public JsonNode requestTree(byte[] body) {
        TextNode raw = TextNode.valueOf(new String(body, StandardCharsets.UTF_8));
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (IOException e) {
            return raw;
        }
        return tree != null && !tree.isMissingNode() ? tree : raw;
    }

    // ========================================================================
    //   Responses
    // ========================================================================

    public byte[] encodeResponse(RpcResponse response) {
        return encode(response);
    }

    public String encodeResponseAsString(RpcResponse response) {
        return new String(encodeResponse(response), StandardCharsets.UTF_8);
    }

    /**
     * @throws MalformedEnvelopeException if the body is not a response envelope
     */
    public RpcResponse decodeResponse(byte[] body) {
        try {
            RpcResponse response = objectMapper.readValue(body, RpcResponse.class);
            if (response == null || response.status() == null) {
                throw new MalformedEnvelopeException("Response envelope has no status", null);
            }
            return response;
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Invalid response envelope: " + e.getMessage(), null, e);
        }
    }

    public RpcResponse decodeResponse(String json) {
        return decodeResponse(json.getBytes(StandardCharsets.UTF_8));
    }

    // ========================================================================
    //   Dead letters
    // ========================================================================

    public byte[] encodeDeadLetter(DeadLetterRecord record) {
        return encode(record);
    }

    // ========================================================================
    //   Helpers
    // ========================================================================

    private byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /**
     * The request id as text, or null when it is absent, blank, or too long to be
     * used as a ledger key.
     */
    private static String recoverId(JsonNode root) {
        JsonNode idNode = root.get("id");
        if (idNode == null || idNode.isNull() || idNode.isContainerNode()) {
            return null;
        }
        String id = idNode.asText();
        if (isBlank(id) || id.length() > MAX_ID_LENGTH) {
            return null;
        }
        return id;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
