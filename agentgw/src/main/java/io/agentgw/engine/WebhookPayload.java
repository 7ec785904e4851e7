package io.agentgw.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * An inbound webhook delivery.
 *
 * @param body parsed JSON when the request declared a JSON content type and parsed, otherwise a text node with the raw body
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayload(
    String name,
    Map<String, String> headers,
    String rawBody,
    JsonNode body,
    Instant receivedAt,
    String sourceIp
) {
}
