package io.agentgw.engine;

public record ConnectorSnapshot(String id, boolean configured, boolean running) {
}
