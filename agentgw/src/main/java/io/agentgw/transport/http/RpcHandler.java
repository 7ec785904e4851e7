package io.agentgw.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.metrics.GatewayMetrics;
import io.agentgw.util.Jsons;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * POST /rpc
 *
 * Request {@code {method, params?, requestId?}}; response {@code {requestId, ok, result}} or
 * {@code {requestId, ok:false, error:{code, message}}}. 401 without a valid bearer, 400 for
 * VALIDATION_ERROR and METHOD_NOT_FOUND, 200 for results and HANDLER_ERROR.
 */
public final class RpcHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(RpcHandler.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String METHOD_NOT_FOUND = "METHOD_NOT_FOUND";
    static final String HANDLER_ERROR = "HANDLER_ERROR";

    private final BearerAuthenticator authenticator;
    private final GatewayMethodRegistry methods;
    private final GatewayMetrics metrics;

    public RpcHandler(BearerAuthenticator authenticator, GatewayMethodRegistry methods, GatewayMetrics metrics) {
        this.authenticator = authenticator;
        this.methods = methods;
        this.metrics = metrics;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Optional<GatewayCallContext> caller = authenticator.authenticate(exchange);
        if (caller.isEmpty()) {
            metrics.recordRpc("unauthorized");
            HttpResponses.unauthorized(exchange);
            return;
        }
        exchange.getRequestReceiver().receiveFullString(
            (ex, body) -> handleBody(ex, body, caller.get()), StandardCharsets.UTF_8);
    }

    private void handleBody(HttpServerExchange exchange, String body, GatewayCallContext caller) {
        JsonNode request;
        try {
            request = Jsons.mapper().readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            reject(exchange, UUID.randomUUID().toString(), VALIDATION_ERROR, "Invalid JSON payload");
            return;
        }
        if (request == null || !request.isObject()) {
            reject(exchange, UUID.randomUUID().toString(), VALIDATION_ERROR, "Request body must be a JSON object");
            return;
        }

        String requestId = request.path("requestId").isTextual() && !request.get("requestId").asText().isBlank()
            ? request.get("requestId").asText()
            : UUID.randomUUID().toString();
        JsonNode methodNode = request.get("method");
        if (methodNode == null || !methodNode.isTextual() || methodNode.asText().isBlank()) {
            reject(exchange, requestId, VALIDATION_ERROR, "method is required");
            return;
        }
        String method = methodNode.asText().trim();
        Optional<MethodDefinition> definition = methods.find(method);
        if (definition.isEmpty()) {
            reject(exchange, requestId, METHOD_NOT_FOUND, "Unknown method: " + method);
            return;
        }

        JsonNode params = request.get("params");
        if (params == null || params.isNull()) {
            params = Jsons.mapper().createObjectNode();
        }

        ObjectNode response = Jsons.mapper().createObjectNode();
        response.put("requestId", requestId);
        try {
            Object result = definition.get().handler().invoke(params, caller);
            response.put("ok", true);
            response.set("result", Jsons.mapper().valueToTree(result));
            metrics.recordRpc("ok");
            log.debug("[RPC] {} ok (request={}, client={})", method, requestId, caller.clientId());
        } catch (Exception e) {
            metrics.recordRpc("handler_error");
            log.warn("[RPC] {} failed (request={}): {}", method, requestId, e.toString());
            response.put("ok", false);
            ObjectNode error = response.putObject("error");
            error.put("code", HANDLER_ERROR);
            error.put("message", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        HttpResponses.json(exchange, 200, response);
    }

    private void reject(HttpServerExchange exchange, String requestId, String code, String message) {
        metrics.recordRpc(code.toLowerCase(Locale.ROOT));
        ObjectNode response = Jsons.mapper().createObjectNode();
        response.put("requestId", requestId);
        response.put("ok", false);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        HttpResponses.json(exchange, 400, response);
    }
}
