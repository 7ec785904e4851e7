package io.agentgw.engine;

public record MessageRequest(String message, String sessionId, String clientId) {
}
