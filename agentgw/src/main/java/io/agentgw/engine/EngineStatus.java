package io.agentgw.engine;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineStatus(boolean connected, String model, String provider, List<ConnectorSnapshot> connectors) {

    public EngineStatus {
        connectors = connectors == null ? List.of() : List.copyOf(connectors);
    }
}
