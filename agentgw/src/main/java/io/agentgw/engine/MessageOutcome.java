package io.agentgw.engine;

public record MessageOutcome(String response, String sessionId) {
}
