package io.agentgw.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentgw.auth.CredentialManager;
import io.agentgw.config.GatewayConfig;
import io.agentgw.engine.GatewayEventBus;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.engine.WebhookHandler;
import io.agentgw.metrics.GatewayMetrics;
import io.agentgw.transport.http.BearerAuthenticator;
import io.agentgw.transport.http.BuiltinRpcMethods;
import io.agentgw.transport.http.GatewayCallContext;
import io.agentgw.transport.http.GatewayHttpHandlers;
import io.agentgw.transport.http.GatewayMethodRegistry;
import io.agentgw.transport.http.HttpResponses;
import io.agentgw.transport.http.HttpRouteRegistry;
import io.agentgw.transport.http.RouteDefinition;
import io.agentgw.transport.http.RpcHandler;
import io.agentgw.transport.ws.GatewayWsHub;
import io.agentgw.util.Jsons;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One Undertow listener carrying the gateway's WebSocket protocol and HTTP surface:
 *
 * <pre>
 *   GET  /ws              WebSocket upgrade
 *   GET  /health          health probe, no auth
 *   POST /webhooks/{name} webhook ingress, no auth, always 202
 *   POST /rpc             JSON-RPC, bearer required
 *   GET  /metrics         Prometheus text, no auth
 *   *    registered routes, bearer required
 * </pre>
 *
 * Unmatched paths answer 401 without a valid bearer and 404 with one.
 */
public final class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    private static final Set<String> RESERVED_PATHS = Set.of("/ws", "/health", "/rpc", "/metrics");

    private final GatewayConfig config;
    private final CredentialManager credentials;
    private final GatewayHandlers handlers;
    private final WebhookHandler webhookHandler;
    private final GatewayEventBus eventBus;
    private final GatewayMetrics metrics;
    private final GatewayMethodRegistry methods;
    private final HttpRouteRegistry routes;
    private final Clock clock;

    private Undertow server;
    private GatewayWsHub hub;
    private Runnable unsubscribe;
    private volatile int boundPort = -1;

    private GatewayServer(Builder b) {
        this.config = b.config;
        this.credentials = b.credentials;
        this.handlers = b.handlers;
        this.webhookHandler = b.webhookHandler;
        this.eventBus = b.eventBus;
        this.metrics = b.metrics;
        this.methods = b.methods;
        this.routes = b.routes;
        this.clock = b.clock;

        BuiltinRpcMethods.register(methods, handlers, credentials, this::gatewayInfo);
    }

    public static Builder builder(GatewayConfig config, CredentialManager credentials, GatewayHandlers handlers) {
        return new Builder(config, credentials, handlers);
    }

    /**
     * Binds the listener and subscribes to the event bus.
     *
     * @throws RuntimeException from Undertow when the bind fails; nothing is left running in that case
     */
    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Gateway server already started");
        }

        GatewayWsHub wsHub = new GatewayWsHub(credentials, handlers, metrics, config.version(),
            config.eventsRequireAuth(), clock);
        BearerAuthenticator authenticator = new BearerAuthenticator(config.staticAuthToken(), credentials, metrics);
        GatewayHttpHandlers http = new GatewayHttpHandlers(config.host(), this::port, config.version(),
            wsHub::getConnectionCount, webhookHandler, metrics, clock);

        RoutingHandler routing = Handlers.routing()
            .get("/ws", wsHub.websocketHandler())
            .get("/health", http::health)
            .post("/webhooks/{name}", new BlockingHandler(http::webhook))
            .post("/rpc", new BlockingHandler(new RpcHandler(authenticator, methods, metrics)))
            .get("/metrics", metrics.handler());

        for (RouteDefinition route : routes.list()) {
            if (RESERVED_PATHS.contains(route.path())) {
                throw new IllegalArgumentException("Route path is reserved by the gateway: " + route.path());
            }
            routing.add(route.method(), route.path(), new BlockingHandler(guarded(route, authenticator)));
            log.info("[HTTP] Mounted {} {} {}", route.method(), route.path(), route.description());
        }
        routing.setFallbackHandler(new BlockingHandler(exchange -> fallback(exchange, authenticator)));

        Undertow undertow = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(routing)
            .build();
        try {
            undertow.start();
        } catch (RuntimeException e) {
            wsHub.shutdown();
            undertow.stop();
            throw e;
        }

        this.server = undertow;
        this.hub = wsHub;
        this.boundPort = ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
        this.unsubscribe = eventBus.subscribe(wsHub::broadcast);

        log.info("[HTTP] Gateway listening on ws://{}:{}/ws (version {})", config.host(), boundPort, config.version());
    }

    /**
     * Unsubscribes from the event bus, closes every socket and stops the listener. Idempotent.
     */
    public synchronized void stop() {
        if (server == null) {
            return;
        }
        if (unsubscribe != null) {
            unsubscribe.run();
        }
        hub.shutdown();
        server.stop();
        log.info("[HTTP] Gateway on port {} stopped", boundPort);
        server = null;
        hub = null;
        unsubscribe = null;
    }

    /**
     * @return the bound port (resolves an ephemeral {@code 0}), or -1 before start
     */
    public int port() {
        return boundPort;
    }

    public String host() {
        return config.host();
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public synchronized int getConnectionCount() {
        return hub == null ? 0 : hub.getConnectionCount();
    }

    public GatewayEventBus getEventBus() {
        return eventBus;
    }

    public GatewayMetrics getMetrics() {
        return metrics;
    }

    private ObjectNode gatewayInfo() {
        ObjectNode info = Jsons.mapper().createObjectNode();
        info.put("host", config.host());
        info.put("port", port());
        info.put("version", config.version());
        info.put("connections", getConnectionCount());
        info.put("now", clock.instant().toString());
        return info;
    }

    private static HttpHandler guarded(RouteDefinition route, BearerAuthenticator authenticator) {
        return exchange -> {
            Optional<GatewayCallContext> caller = authenticator.authenticate(exchange);
            if (caller.isEmpty()) {
                HttpResponses.unauthorized(exchange);
                return;
            }
            try {
                route.handler().handle(exchange, caller.get());
            } catch (Exception e) {
                log.error("[HTTP] Route {} {} failed: {}", route.method(), route.path(), e.getMessage(), e);
                if (!exchange.isResponseStarted()) {
                    HttpResponses.error(exchange, 500, "Route handler failed");
                }
            }
        };
    }

    private static void fallback(HttpServerExchange exchange, BearerAuthenticator authenticator) {
        if (authenticator.authenticate(exchange).isEmpty()) {
            HttpResponses.unauthorized(exchange);
        } else {
            HttpResponses.notFound(exchange);
        }
    }

    public static final class Builder {
        private final GatewayConfig config;
        private final CredentialManager credentials;
        private final GatewayHandlers handlers;
        private WebhookHandler webhookHandler;
        private GatewayEventBus eventBus;
        private GatewayMetrics metrics;
        private GatewayMethodRegistry methods;
        private HttpRouteRegistry routes;
        private Clock clock = Clock.systemUTC();

        private Builder(GatewayConfig config, CredentialManager credentials, GatewayHandlers handlers) {
            this.config = Objects.requireNonNull(config, "config");
            this.credentials = Objects.requireNonNull(credentials, "credentials");
            this.handlers = Objects.requireNonNull(handlers, "handlers");
        }

        public Builder webhookHandler(WebhookHandler webhookHandler) {
            this.webhookHandler = webhookHandler;
            return this;
        }

        public Builder eventBus(GatewayEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder metrics(GatewayMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder methods(GatewayMethodRegistry methods) {
            this.methods = methods;
            return this;
        }

        public Builder routes(HttpRouteRegistry routes) {
            this.routes = routes;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GatewayServer build() {
            if (eventBus == null) {
                eventBus = new GatewayEventBus(clock);
            }
            if (metrics == null) {
                metrics = new GatewayMetrics();
            }
            if (methods == null) {
                methods = new GatewayMethodRegistry();
            }
            if (routes == null) {
                routes = new HttpRouteRegistry();
            }
            return new GatewayServer(this);
        }
    }
}
