package io.agentgw.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.auth.CredentialManager;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.engine.MessageOutcome;
import io.agentgw.engine.MessageRequest;
import io.agentgw.util.Jsons;

import java.util.function.Supplier;

/**
 * Methods every gateway exposes over {@code /rpc}.
 */
public final class BuiltinRpcMethods {

    private BuiltinRpcMethods() {
    }

    /**
     * @param gatewayInfo listener facts (host, port, version, connections) for {@code gateway.status}
     */
    public static void register(GatewayMethodRegistry registry,
                                GatewayHandlers handlers,
                                CredentialManager credentials,
                                Supplier<ObjectNode> gatewayInfo) {
        registry.register("gateway.status", "Gateway listener and engine status", (params, ctx) -> {
            ObjectNode status = gatewayInfo.get();
            status.set("engine", Jsons.mapper().valueToTree(handlers.getStatus()));
            return status;
        });
        registry.register("sessions.list", "Engine sessions, most recent first", (params, ctx) -> handlers.listSessions());
        registry.register("auth.summary", "Active tokens and pending pairing codes", (params, ctx) -> credentials.getSummary());
        registry.register("message.send", "Process one message and return the full response", (params, ctx) -> {
            String message = text(params, "message");
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("params.message is required");
            }
            String sessionId = text(params, "sessionId");
            if (sessionId == null || sessionId.isBlank()) {
                sessionId = "gateway:" + ctx.clientId();
            }
            MessageOutcome outcome = handlers.processMessage(
                new MessageRequest(message.trim(), sessionId, ctx.clientId()), chunk -> { });
            ObjectNode result = Jsons.mapper().createObjectNode();
            result.put("sessionId", outcome.sessionId() == null ? sessionId : outcome.sessionId());
            result.put("response", outcome.response());
            return result;
        });
    }

    private static String text(JsonNode params, String field) {
        JsonNode value = params.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
