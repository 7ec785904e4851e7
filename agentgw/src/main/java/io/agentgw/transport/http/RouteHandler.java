package io.agentgw.transport.http;

import io.undertow.server.HttpServerExchange;

/**
 * A registered HTTP route. Invoked on a worker thread after the bearer check passed.
 */
@FunctionalInterface
public interface RouteHandler {

    void handle(HttpServerExchange exchange, GatewayCallContext context) throws Exception;
}
