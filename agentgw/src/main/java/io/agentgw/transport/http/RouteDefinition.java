package io.agentgw.transport.http;

import java.util.Locale;
import java.util.Objects;

/**
 * @param path Undertow path template, e.g. {@code /jobs/{id}}
 */
public record RouteDefinition(String method, String path, String description, RouteHandler handler) {

    public RouteDefinition {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Route method is required");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Route path must start with '/': " + path);
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        description = description == null ? "" : description;
        Objects.requireNonNull(handler, "handler");
    }

    String key() {
        return method + " " + path;
    }
}
