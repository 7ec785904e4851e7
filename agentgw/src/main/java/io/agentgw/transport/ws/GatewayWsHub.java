package io.agentgw.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.auth.AuthClient;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.IssuedToken;
import io.agentgw.engine.GatewayEvent;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.metrics.GatewayMetrics;
import io.agentgw.metrics.GatewayMetrics.SendResult;
import io.agentgw.util.Jsons;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Undertow-native WebSocket hub for the gateway protocol:
 * - hello on connect, then authenticate or pair on the socket (once; the identity is fixed after auth_ok)
 * - subscribe to broadcast events, independent of authorization
 * - correlated commands answered by command_event frames and one command_result
 * - malformed frames answered by rpc_error, never by closing the socket
 *
 * Inbound frames are handled in arrival order on a single protocol thread; handler calls run on
 * the command pool.
 */
public final class GatewayWsHub {
    private static final Logger log = LoggerFactory.getLogger(GatewayWsHub.class);

    // Channel -> Session
    private final ConcurrentMap<WebSocketChannel, ConnectionSession> sessions = new ConcurrentHashMap<>();

    private final ExecutorService protocolExecutor = Executors.newSingleThreadExecutor(named("gateway-protocol", false));
    private final ExecutorService commandExecutor = Executors.newCachedThreadPool(named("gateway-command", true));

    private final CredentialManager credentials;
    private final CommandDispatcher dispatcher;
    private final GatewayMetrics metrics;
    private final String version;
    private final boolean eventsRequireAuth;
    private final Clock clock;

    public GatewayWsHub(CredentialManager credentials,
                        GatewayHandlers handlers,
                        GatewayMetrics metrics,
                        String version,
                        boolean eventsRequireAuth,
                        Clock clock) {
        this.credentials = credentials;
        this.metrics = metrics;
        this.version = version;
        this.eventsRequireAuth = eventsRequireAuth;
        this.clock = clock;
        this.dispatcher = new CommandDispatcher(handlers, credentials, metrics, clock);
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                ConnectionSession session = new ConnectionSession(UUID.randomUUID().toString(), clock.instant());
                sessions.put(channel, session);
                metrics.connectionOpened();
                log.info("[WS] Connected: {} (connection={})", channel.getSourceAddress(), session.getConnectionId());

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        String raw = message.getData();
                        try {
                            protocolExecutor.execute(() -> handleClientMessage(ch, raw));
                        } catch (RejectedExecutionException e) {
                            log.debug("[WS] Dropping frame after shutdown from {}", ch.getSourceAddress());
                        }
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] Error on {}: {}", ch.getSourceAddress(), error.toString());
                        cleanup(ch);
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch));

                channel.resumeReceives();
                send(channel, GatewayFrames.hello(version, clock.instant()));
            }
        });
    }

    void handleClientMessage(WebSocketChannel channel, String raw) {
        ConnectionSession session = sessions.get(channel);
        if (session == null) {
            return;
        }

        JsonNode msg;
        try {
            msg = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            send(channel, GatewayFrames.rpcError("Invalid JSON payload", clock.instant()));
            return;
        }
        if (msg == null || !msg.isObject() || !msg.path("type").isTextual()) {
            send(channel, GatewayFrames.rpcError("Invalid message shape", clock.instant()));
            return;
        }

        String type = msg.get("type").asText();
        try {
            switch (type) {
                case "ping" -> send(channel, GatewayFrames.pong(clock.instant()));
                case "subscribe" -> {
                    session.subscribe();
                    send(channel, GatewayFrames.subscribed(clock.instant()));
                }
                case "authenticate" -> {
                    if (session.isAuthorized()) {
                        rejectReauthentication(channel, session, type);
                    } else {
                        authenticate(channel, session, textField(msg, "token"));
                    }
                }
                case "pair" -> {
                    if (session.isAuthorized()) {
                        rejectReauthentication(channel, session, type);
                    } else {
                        pair(channel, session, textField(msg, "code"), textField(msg, "label"));
                    }
                }
                case "command" -> command(channel, session, msg);
                default -> {
                    if (!session.isAuthorized()) {
                        send(channel, GatewayFrames.authError("Authenticate first"));
                    } else {
                        send(channel, GatewayFrames.rpcError("Unsupported message type: " + type, clock.instant()));
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("[WS] Failed to handle {} frame on connection {}: {}", type, session.getConnectionId(), e.getMessage(), e);
            send(channel, GatewayFrames.rpcError("Internal gateway error", clock.instant()));
        }
    }

    /**
     * A socket keeps the identity it authenticated with; switching clients needs a new connection.
     */
    private void rejectReauthentication(WebSocketChannel channel, ConnectionSession session, String type) {
        log.debug("[AUTH] Ignoring {} on already authorized connection {}", type, session.getConnectionId());
        send(channel, GatewayFrames.rpcError("Expected command message", clock.instant()));
    }

    private void authenticate(WebSocketChannel channel, ConnectionSession session, String token) {
        Optional<AuthClient> client = credentials.authenticate(token);
        metrics.recordAuth("token", client.isPresent());
        if (client.isEmpty()) {
            log.warn("[AUTH] Token rejected on connection {}", session.getConnectionId());
            send(channel, GatewayFrames.authError("Invalid token"));
            return;
        }
        session.authorize(client.get(), token.trim());
        log.info("[AUTH] Connection {} authenticated as {} ({})",
            session.getConnectionId(), client.get().id(), client.get().label());
        send(channel, GatewayFrames.authOk(client.get()));
    }

    private void pair(WebSocketChannel channel, ConnectionSession session, String code, String label) {
        Optional<IssuedToken> issued = credentials.consumePairingCode(code, label);
        metrics.recordAuth("pairing", issued.isPresent());
        if (issued.isEmpty()) {
            log.warn("[AUTH] Pairing code rejected on connection {}", session.getConnectionId());
            send(channel, GatewayFrames.authError("Invalid or expired pairing code"));
            return;
        }
        session.authorize(issued.get().client(), issued.get().token());
        log.info("[AUTH] Connection {} paired as {} ({})",
            session.getConnectionId(), issued.get().client().id(), issued.get().client().label());
        send(channel, GatewayFrames.paired(issued.get()));
        send(channel, GatewayFrames.authOk(issued.get().client()));
    }

    private void command(WebSocketChannel channel, ConnectionSession session, JsonNode msg) {
        if (!session.isAuthorized()) {
            metrics.recordCommand(textOrUnknown(msg), "unauthorized", -1);
            send(channel, GatewayFrames.authError("Authenticate first"));
            return;
        }
        String id = textField(msg, "id");
        if (id == null || id.isBlank()) {
            send(channel, GatewayFrames.rpcError("Command id is required", clock.instant()));
            return;
        }
        String name = textField(msg, "name");
        if (name == null || name.isBlank()) {
            send(channel, GatewayFrames.commandFailure(id.trim(), "Command name is required"));
            return;
        }

        String commandId = id.trim();
        JsonNode payload = msg.get("payload");
        CommandDispatcher.Replies replies = new CommandDispatcher.Replies() {
            @Override
            public void event(String event, JsonNode data) {
                send(channel, GatewayFrames.commandEvent(commandId, event, data));
            }

            @Override
            public void success(JsonNode result) {
                send(channel, GatewayFrames.commandSuccess(commandId, result));
            }

            @Override
            public void failure(String error) {
                send(channel, GatewayFrames.commandFailure(commandId, error));
            }
        };
        try {
            commandExecutor.execute(() -> dispatcher.dispatch(session, name.trim(), payload, replies));
        } catch (RejectedExecutionException e) {
            replies.failure("Gateway is shutting down");
        }
    }

    /**
     * Writes one event to every eligible socket. Each socket's write is reported to the metrics
     * as delivered, failed, or skipped (socket already closing); a failed write never affects
     * the other sockets or the caller.
     *
     * @return number of sockets the event was handed to
     */
    public int broadcast(GatewayEvent event) {
        String json = Jsons.toJson(GatewayFrames.event(event));
        int attempted = 0;
        for (var entry : sessions.entrySet()) {
            WebSocketChannel channel = entry.getKey();
            ConnectionSession session = entry.getValue();
            if (!receivesEvents(session)) {
                continue;
            }
            if (!channel.isOpen() || channel.isCloseFrameSent()) {
                metrics.recordBroadcastSend(SendResult.SKIPPED);
                log.debug("[WS] Skipped {} for closing connection {}", event.type(), session.getConnectionId());
                continue;
            }
            attempted++;
            WebSockets.sendText(json, channel, new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                    metrics.recordBroadcastSend(SendResult.DELIVERED);
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                    metrics.recordBroadcastSend(SendResult.FAILED);
                    log.warn("[WS] Broadcast of {} to connection {} failed: {}",
                        event.type(), session.getConnectionId(), throwable.toString());
                }
            });
        }
        return attempted;
    }

    private boolean receivesEvents(ConnectionSession session) {
        return session.isSubscribed() && (!eventsRequireAuth || session.isAuthorized());
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    /**
     * Closes every socket, discards all sessions and stops both executors.
     */
    public void shutdown() {
        for (WebSocketChannel channel : sessions.keySet()) {
            cleanup(channel);
        }
        sessions.clear();
        protocolExecutor.shutdownNow();
        commandExecutor.shutdownNow();
    }

    private void send(WebSocketChannel channel, ObjectNode frame) {
        if (!channel.isOpen()) {
            return;
        }
        WebSockets.sendText(Jsons.toJson(frame), channel, null);
    }

    private void cleanup(WebSocketChannel channel) {
        ConnectionSession session = sessions.remove(channel);
        if (session != null) {
            metrics.connectionClosed();
            log.info("[WS] Disconnected: {} (connection={}, client={})",
                channel.getSourceAddress(), session.getConnectionId(), session.getClientId());
        }
        if (channel.isOpen()) {
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("[WS] Close failed for {}: {}", channel.getSourceAddress(), e.toString());
            }
        }
    }

    private static String textField(JsonNode msg, String field) {
        JsonNode value = msg.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String textOrUnknown(JsonNode msg) {
        String name = textField(msg, "name");
        return name == null || name.isBlank() ? "unknown" : name.trim();
    }

    private static ThreadFactory named(String prefix, boolean numbered) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, numbered ? prefix + "-" + seq.incrementAndGet() : prefix);
            t.setDaemon(true);
            return t;
        };
    }
}
