package com.intteq.broker.rpc.envelope;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Body published to the dead-letter queue. Nothing in this service reads it back.
 *
 * @param request the original request body, parsed when it was valid JSON and
 *                otherwise kept as a string
 */
@JsonPropertyOrder({"failed_at", "reason", "request", "correlation_id", "reply_to", "retry_count"})
public record DeadLetterRecord(
        @JsonProperty("failed_at") Instant failedAt,
        @JsonProperty("reason") String reason,
        @JsonProperty("request") JsonNode request,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("reply_to") String replyTo,
        @JsonProperty("retry_count") int retryCount
) {
}
