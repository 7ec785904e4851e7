package io.agentgw.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.IssuedToken;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.engine.MessageOutcome;
import io.agentgw.engine.MessageRequest;
import io.agentgw.metrics.GatewayMetrics;
import io.agentgw.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Resolves a command name to a handler call and reports the outcome through {@link Replies}.
 * Runs on the command pool; every path ends in exactly one {@code command_result}.
 */
final class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final GatewayHandlers handlers;
    private final CredentialManager credentials;
    private final GatewayMetrics metrics;
    private final Clock clock;

    /**
     * Frame sink for one command on one socket.
     */
    interface Replies {
        void event(String event, JsonNode data);

        void success(JsonNode result);

        void failure(String error);
    }

    CommandDispatcher(GatewayHandlers handlers, CredentialManager credentials, GatewayMetrics metrics, Clock clock) {
        this.handlers = handlers;
        this.credentials = credentials;
        this.metrics = metrics;
        this.clock = clock;
    }

    void dispatch(ConnectionSession session, String name, JsonNode payload, Replies replies) {
        long started = System.nanoTime();
        String outcome = "ok";
        try {
            switch (name) {
                case "ping" -> {
                    ObjectNode result = Jsons.mapper().createObjectNode();
                    result.put("pong", clock.millis());
                    replies.success(result);
                }
                case "status.get" -> replies.success(Jsons.mapper().valueToTree(handlers.getStatus()));
                case "sessions.list" -> replies.success(Jsons.mapper().valueToTree(handlers.listSessions()));
                case "auth.summary" -> replies.success(Jsons.mapper().valueToTree(credentials.getSummary()));
                case "auth.rotate" -> {
                    if (!rotate(session, replies)) {
                        outcome = "error";
                    }
                }
                case "message.send" -> {
                    if (!sendMessage(session, payload, replies)) {
                        outcome = "error";
                    }
                }
                default -> {
                    outcome = "unknown";
                    replies.failure("Unsupported command: " + name);
                }
            }
        } catch (Exception e) {
            outcome = "error";
            log.warn("[WS] Command {} failed for client {}: {}", name, session.getClientId(), e.toString());
            replies.failure(errorText(e));
        }
        metrics.recordCommand(name, outcome, (System.nanoTime() - started) / 1e9);
    }

    private boolean rotate(ConnectionSession session, Replies replies) {
        Optional<IssuedToken> rotated = credentials.rotateToken(session.getToken());
        if (rotated.isEmpty()) {
            replies.failure("Token rotation failed");
            return false;
        }
        IssuedToken issued = rotated.get();
        session.authorize(issued.client(), issued.token());

        ObjectNode result = Jsons.mapper().createObjectNode();
        result.put("token", issued.token());
        result.put("clientId", issued.client().id());
        result.put("label", issued.client().label());
        replies.success(result);
        return true;
    }

    private boolean sendMessage(ConnectionSession session, JsonNode payload, Replies replies) throws Exception {
        String message = text(payload, "message");
        if (message == null || message.isBlank()) {
            replies.failure("payload.message is required");
            return false;
        }
        String sessionId = text(payload, "sessionId");
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = "gateway:" + session.getClientId();
        }

        ObjectNode startedData = Jsons.mapper().createObjectNode();
        startedData.put("sessionId", sessionId);
        replies.event("started", startedData);

        MessageOutcome outcome = handlers.processMessage(
            new MessageRequest(message.trim(), sessionId, session.getClientId()),
            chunk -> {
                if (chunk == null || chunk.isEmpty()) {
                    return;
                }
                ObjectNode data = Jsons.mapper().createObjectNode();
                data.put("chunk", chunk);
                replies.event("chunk", data);
            });

        String resolvedSession = outcome.sessionId() == null ? sessionId : outcome.sessionId();
        ObjectNode completed = Jsons.mapper().createObjectNode();
        completed.put("sessionId", resolvedSession);
        replies.event("completed", completed);

        ObjectNode result = Jsons.mapper().createObjectNode();
        result.put("sessionId", resolvedSession);
        result.put("response", outcome.response());
        replies.success(result);
        return true;
    }

    private static String text(JsonNode payload, String field) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode value = payload.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static String errorText(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
