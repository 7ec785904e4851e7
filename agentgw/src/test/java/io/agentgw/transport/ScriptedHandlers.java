package io.agentgw.transport;

import io.agentgw.engine.EngineStatus;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.engine.MessageOutcome;
import io.agentgw.engine.MessageRequest;
import io.agentgw.engine.SessionSummary;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Engine stand-in: streams {@code chunk:<message>}, fails on {@code explode}.
 */
final class ScriptedHandlers implements GatewayHandlers {
    final List<MessageRequest> requests = new CopyOnWriteArrayList<>();

    @Override
    public MessageOutcome processMessage(MessageRequest request, Consumer<String> onChunk) {
        requests.add(request);
        if ("explode".equals(request.message())) {
            throw new IllegalStateException("engine failure");
        }
        onChunk.accept("");
        onChunk.accept("chunk:" + request.message());
        return new MessageOutcome("reply:" + request.message(), request.sessionId());
    }

    @Override
    public List<SessionSummary> listSessions() {
        return List.of(new SessionSummary("s", 3, Instant.parse("2025-01-01T00:00:00Z"), "hello"));
    }

    @Override
    public EngineStatus getStatus() {
        return new EngineStatus(true, "test-model", "test-provider", List.of());
    }
}
