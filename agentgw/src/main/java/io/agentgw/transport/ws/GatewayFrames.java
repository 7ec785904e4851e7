package io.agentgw.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.auth.AuthClient;
import io.agentgw.auth.IssuedToken;
import io.agentgw.engine.GatewayEvent;
import io.agentgw.util.Jsons;

import java.time.Instant;

/**
 * Builders for server-to-client frames. One JSON object per frame, discriminated by {@code type}.
 */
final class GatewayFrames {

    static final String HELLO = "hello";
    static final String AUTH_OK = "auth_ok";
    static final String AUTH_ERROR = "auth_error";
    static final String PAIRED = "paired";
    static final String SUBSCRIBED = "subscribed";
    static final String COMMAND_EVENT = "command_event";
    static final String COMMAND_RESULT = "command_result";
    static final String EVENT = "event";
    static final String RPC_ERROR = "rpc_error";
    static final String PONG = "pong";

    private GatewayFrames() {
    }

    static ObjectNode hello(String version, Instant now) {
        ObjectNode frame = frame(HELLO);
        frame.put("version", version);
        frame.put("authRequired", true);
        frame.put("serverTime", now.toString());
        return frame;
    }

    static ObjectNode authOk(AuthClient client) {
        ObjectNode frame = frame(AUTH_OK);
        frame.put("clientId", client.id());
        frame.put("label", client.label());
        frame.put("tokenIssuedAt", String.valueOf(client.tokenIssuedAt()));
        return frame;
    }

    static ObjectNode authError(String message) {
        ObjectNode frame = frame(AUTH_ERROR);
        frame.put("message", message);
        return frame;
    }

    static ObjectNode paired(IssuedToken issued) {
        ObjectNode frame = frame(PAIRED);
        frame.put("token", issued.token());
        frame.put("clientId", issued.client().id());
        frame.put("label", issued.client().label());
        frame.put("tokenIssuedAt", String.valueOf(issued.client().tokenIssuedAt()));
        return frame;
    }

    static ObjectNode subscribed(Instant now) {
        ObjectNode frame = frame(SUBSCRIBED);
        frame.put("ok", true);
        frame.put("at", now.toString());
        return frame;
    }

    static ObjectNode commandEvent(String id, String event, JsonNode data) {
        ObjectNode frame = frame(COMMAND_EVENT);
        frame.put("id", id);
        frame.put("event", event);
        if (data != null) {
            frame.set("data", data);
        }
        return frame;
    }

    static ObjectNode commandSuccess(String id, JsonNode result) {
        ObjectNode frame = frame(COMMAND_RESULT);
        frame.put("id", id);
        frame.put("ok", true);
        frame.set("result", result == null ? Jsons.mapper().nullNode() : result);
        return frame;
    }

    static ObjectNode commandFailure(String id, String error) {
        ObjectNode frame = frame(COMMAND_RESULT);
        frame.put("id", id);
        frame.put("ok", false);
        frame.put("error", error);
        return frame;
    }

    static ObjectNode event(GatewayEvent event) {
        ObjectNode frame = frame(EVENT);
        ObjectNode body = frame.putObject("event");
        body.put("type", event.type());
        body.set("payload", event.payload());
        body.put("at", event.at().toString());
        return frame;
    }

    static ObjectNode rpcError(String error, Instant now) {
        ObjectNode frame = frame(RPC_ERROR);
        frame.put("error", error);
        frame.put("at", now.toString());
        return frame;
    }

    static ObjectNode pong(Instant now) {
        ObjectNode frame = frame(PONG);
        frame.put("ts", now.toEpochMilli());
        return frame;
    }

    private static ObjectNode frame(String type) {
        ObjectNode frame = Jsons.mapper().createObjectNode();
        frame.put("type", type);
        return frame;
    }
}
