package io.agentgw.engine;

import java.time.Instant;

public record SessionSummary(String id, int messageCount, Instant lastActivity, String preview) {
}
