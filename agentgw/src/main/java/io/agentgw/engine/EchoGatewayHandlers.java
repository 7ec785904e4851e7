package io.agentgw.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Stand-in engine used when no {@link GatewayEngineFactory} is installed. Echoes each message
 * back as one chunk and tracks per-session counts, and publishes a {@code message.processed}
 * event for every message.
 */
public final class EchoGatewayHandlers implements GatewayHandlers {

    private final GatewayEventBus eventBus;
    private final Clock clock;
    private final Map<String, SessionSummary> sessions = new ConcurrentHashMap<>();

    public EchoGatewayHandlers(GatewayEventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    public EchoGatewayHandlers(GatewayEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public MessageOutcome processMessage(MessageRequest request, Consumer<String> onChunk) {
        String response = "echo:" + request.message();
        onChunk.accept(response);

        Instant now = clock.instant();
        String preview = request.message().length() > 60 ? request.message().substring(0, 60) : request.message();
        sessions.merge(request.sessionId(),
            new SessionSummary(request.sessionId(), 1, now, preview),
            (old, fresh) -> new SessionSummary(old.id(), old.messageCount() + 1, now, preview));

        eventBus.publish("message.processed", Map.of("sessionId", request.sessionId(), "clientId", request.clientId()));
        return new MessageOutcome(response, request.sessionId());
    }

    @Override
    public List<SessionSummary> listSessions() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(SessionSummary::lastActivity).reversed())
            .toList();
    }

    @Override
    public EngineStatus getStatus() {
        return new EngineStatus(true, "echo", "local", List.of());
    }

    /**
     * Factory used as the fallback when service discovery finds nothing.
     */
    public static final class Factory implements GatewayEngineFactory {
        @Override
        public GatewayHandlers createHandlers(GatewayEventBus eventBus) {
            return new EchoGatewayHandlers(eventBus);
        }

        @Override
        public WebhookHandler createWebhookHandler(GatewayEventBus eventBus) {
            return payload -> {
                eventBus.publish("webhook.received", Map.of("name", payload.name()));
                return Map.of("matchedJobs", 0);
            };
        }
    }
}
