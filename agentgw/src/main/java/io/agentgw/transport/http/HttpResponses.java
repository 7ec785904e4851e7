package io.agentgw.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.util.Jsons;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;

/**
 * JSON response helpers shared by the gateway HTTP handlers.
 */
public final class HttpResponses {
    static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    private HttpResponses() {
    }

    public static void json(HttpServerExchange exchange, int status, Object body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(Jsons.toJson(body), StandardCharsets.UTF_8);
    }

    public static void error(HttpServerExchange exchange, int status, String error) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("ok", false);
        body.put("error", error);
        json(exchange, status, body);
    }

    public static void unauthorized(HttpServerExchange exchange) {
        error(exchange, 401, "Unauthorized");
    }

    public static void notFound(HttpServerExchange exchange) {
        error(exchange, 404, "Not found");
    }
}
