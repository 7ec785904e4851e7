package io.agentgw.transport.http;

import java.util.Objects;

public record MethodDefinition(String id, String description, RpcMethod handler) {

    public MethodDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Method id is required");
        }
        id = id.trim();
        description = description == null ? "" : description;
        Objects.requireNonNull(handler, "handler");
    }
}
