package io.agentgw.transport.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON-RPC methods callable through {@code POST /rpc}. Ids are unique.
 */
public final class GatewayMethodRegistry {
    private final Map<String, MethodDefinition> methods = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException when a method with the same id is already registered
     */
    public GatewayMethodRegistry register(MethodDefinition definition) {
        MethodDefinition existing = methods.putIfAbsent(definition.id(), definition);
        if (existing != null) {
            throw new IllegalArgumentException("Gateway method already registered: " + definition.id());
        }
        return this;
    }

    public GatewayMethodRegistry register(String id, String description, RpcMethod handler) {
        return register(new MethodDefinition(id, description, handler));
    }

    public Optional<MethodDefinition> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(methods.get(id.trim()));
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public List<MethodDefinition> list() {
        List<MethodDefinition> all = new ArrayList<>(methods.values());
        all.sort((a, b) -> a.id().compareTo(b.id()));
        return all;
    }
}
