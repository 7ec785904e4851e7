package io.agentgw.transport.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Additional HTTP routes mounted by the gateway at start. A method+path pair may be registered once.
 */
public final class HttpRouteRegistry {
    private final Map<String, RouteDefinition> routes = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException on a duplicate method+path
     */
    public HttpRouteRegistry register(RouteDefinition route) {
        RouteDefinition existing = routes.putIfAbsent(route.key(), route);
        if (existing != null) {
            throw new IllegalArgumentException("HTTP route already registered: " + route.key());
        }
        return this;
    }

    public HttpRouteRegistry register(String method, String path, String description, RouteHandler handler) {
        return register(new RouteDefinition(method, path, description, handler));
    }

    public List<RouteDefinition> list() {
        List<RouteDefinition> all = new ArrayList<>(routes.values());
        all.sort((a, b) -> a.key().compareTo(b.key()));
        return all;
    }
}
