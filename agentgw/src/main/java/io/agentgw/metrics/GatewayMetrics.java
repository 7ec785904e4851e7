package io.agentgw.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Prometheus instrumentation for the gateway.
 *
 * Key Metrics:
 * - gateway_ws_connections - open WebSocket connections
 * - gateway_auth_attempts_total{method, outcome} - token/pairing authentication results
 * - gateway_commands_total{command, outcome} - command dispatch results
 * - gateway_command_latency_seconds{command} - handler latency
 * - gateway_broadcast_sends_total{result} - per-socket broadcast send results (delivered/failed/skipped)
 * - gateway_webhooks_total{outcome} - webhook deliveries
 * - gateway_rpc_requests_total{outcome} - JSON-RPC requests
 *
 * Command labels are limited to the built-in command names; anything a client invents is
 * counted as {@code unknown}.
 */
public class GatewayMetrics {
    private static final Logger log = LoggerFactory.getLogger(GatewayMetrics.class);

    static final String UNKNOWN_COMMAND = "unknown";
    static final Set<String> KNOWN_COMMANDS = Set.of(
        "message.send", "sessions.list", "status.get", "ping", "auth.rotate", "auth.summary");

    private final CollectorRegistry registry;

    private final Gauge connections;
    private final Counter authAttempts;
    private final Counter commands;
    private final Histogram commandLatency;
    private final Counter broadcastSends;
    private final Counter webhooks;
    private final Counter rpcRequests;

    public GatewayMetrics() {
        this(new CollectorRegistry());
    }

    public GatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connections = Gauge.build()
            .name("gateway_ws_connections")
            .help("Open WebSocket connections")
            .register(registry);

        this.authAttempts = Counter.build()
            .name("gateway_auth_attempts_total")
            .help("Authentication attempts by method and outcome")
            .labelNames("method", "outcome")
            .register(registry);

        this.commands = Counter.build()
            .name("gateway_commands_total")
            .help("Commands dispatched by name and outcome")
            .labelNames("command", "outcome")
            .register(registry);

        this.commandLatency = Histogram.build()
            .name("gateway_command_latency_seconds")
            .help("Command handler latency in seconds")
            .labelNames("command")
            .buckets(0.005, 0.05, 0.25, 1.0, 5.0, 30.0, 120.0)
            .register(registry);

        this.broadcastSends = Counter.build()
            .name("gateway_broadcast_sends_total")
            .help("Per-socket broadcast send results")
            .labelNames("result")
            .register(registry);

        this.webhooks = Counter.build()
            .name("gateway_webhooks_total")
            .help("Webhook deliveries by outcome")
            .labelNames("outcome")
            .register(registry);

        this.rpcRequests = Counter.build()
            .name("gateway_rpc_requests_total")
            .help("JSON-RPC requests by outcome")
            .labelNames("outcome")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void connectionOpened() {
        connections.inc();
    }

    public void connectionClosed() {
        connections.dec();
    }

    public void recordAuth(String method, boolean success) {
        authAttempts.labels(method, success ? "success" : "rejected").inc();
    }

    public void recordCommand(String command, String outcome, double seconds) {
        String label = commandLabel(command);
        commands.labels(label, outcome).inc();
        if (seconds >= 0) {
            commandLatency.labels(label).observe(seconds);
        }
    }

    static String commandLabel(String command) {
        return command != null && KNOWN_COMMANDS.contains(command) ? command : UNKNOWN_COMMAND;
    }

    public void recordBroadcastSend(SendResult result) {
        broadcastSends.labels(result.label()).inc();
    }

    public void recordWebhook(String outcome) {
        webhooks.labels(outcome).inc();
    }

    public void recordRpc(String outcome) {
        rpcRequests.labels(outcome).inc();
    }

    /**
     * {@code GET /metrics}: text exposition of this registry, negotiated from {@code Accept}.
     * Repeated {@code name[]} query parameters restrict the output to those families.
     */
    public HttpHandler handler() {
        return this::export;
    }

    private void export(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, names == null
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(new HashSet<>(names)));
        } catch (IOException e) {
            log.error("[HTTP] Metrics export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Metrics export failed");
            return;
        }
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
    }

    public double broadcastSends(SendResult result) {
        Double value = registry.getSampleValue("gateway_broadcast_sends_total", new String[]{"result"}, new String[]{result.label()});
        return value == null ? 0 : value;
    }

    /**
     * Outcome of writing one frame to one socket.
     */
    public enum SendResult {
        DELIVERED("delivered"),
        FAILED("failed"),
        SKIPPED("skipped");

        private final String label;

        SendResult(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
