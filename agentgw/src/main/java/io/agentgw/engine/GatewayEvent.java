package io.agentgw.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A broadcast event: {@code {type, payload, at}}.
 */
public record GatewayEvent(String type, JsonNode payload, Instant at) {
}
