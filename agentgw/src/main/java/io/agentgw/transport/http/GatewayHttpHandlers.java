package io.agentgw.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentgw.engine.WebhookHandler;
import io.agentgw.engine.WebhookPayload;
import io.agentgw.metrics.GatewayMetrics;
import io.agentgw.util.Jsons;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntSupplier;

/**
 * Unauthenticated HTTP endpoints: health probe and webhook ingress.
 */
public final class GatewayHttpHandlers {
    private static final Logger log = LoggerFactory.getLogger(GatewayHttpHandlers.class);

    private final String host;
    private final IntSupplier port;
    private final String version;
    private final IntSupplier connections;
    private final WebhookHandler webhookHandler;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public GatewayHttpHandlers(String host,
                               IntSupplier port,
                               String version,
                               IntSupplier connections,
                               WebhookHandler webhookHandler,
                               GatewayMetrics metrics,
                               Clock clock) {
        this.host = host;
        this.port = port;
        this.version = version;
        this.connections = connections;
        this.webhookHandler = webhookHandler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = Jsons.mapper().createObjectNode();
        health.put("ok", true);
        health.put("status", "ok");
        health.put("host", host);
        health.put("port", port.getAsInt());
        health.put("version", version);
        health.put("now", clock.instant().toString());
        health.put("connections", connections.getAsInt());
        HttpResponses.json(exchange, 200, health);
    }

    /**
     * POST /webhooks/{name}
     * Always answers 202. A failing handler is logged and reported as zero matched jobs.
     */
    public void webhook(HttpServerExchange exchange) {
        String name = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("name");
        exchange.getRequestReceiver().receiveFullString((ex, rawBody) -> {
            WebhookPayload payload = new WebhookPayload(
                name,
                lowerCasedHeaders(ex),
                rawBody,
                parseBody(ex, rawBody),
                clock.instant(),
                sourceIp(ex));

            ObjectNode response = Jsons.mapper().createObjectNode();
            response.put("accepted", true);
            response.put("webhook", name);
            response.put("matchedJobs", 0);

            if (webhookHandler == null) {
                metrics.recordWebhook("unhandled");
                HttpResponses.json(ex, 202, response);
                return;
            }
            try {
                Map<String, Object> result = webhookHandler.handleWebhook(payload);
                if (result != null) {
                    ObjectNode merged = Jsons.mapper().valueToTree(result);
                    merged.remove("accepted");
                    merged.remove("webhook");
                    response.setAll(merged);
                }
                metrics.recordWebhook("handled");
                log.info("[HTTP] Webhook {} handled: matchedJobs={}", name, response.path("matchedJobs").asInt());
            } catch (Exception e) {
                metrics.recordWebhook("failed");
                log.warn("[HTTP] Webhook {} handler failed: {}", name, e.toString());
                response.put("matchedJobs", 0);
            }
            HttpResponses.json(ex, 202, response);
        }, StandardCharsets.UTF_8);
    }

    private static Map<String, String> lowerCasedHeaders(HttpServerExchange exchange) {
        Map<String, String> headers = new TreeMap<>();
        for (HeaderValues values : exchange.getRequestHeaders()) {
            headers.put(values.getHeaderName().toString().toLowerCase(Locale.ROOT), String.join(", ", values));
        }
        return headers;
    }

    private static JsonNode parseBody(HttpServerExchange exchange, String rawBody) {
        String contentType = exchange.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("json")) {
            return TextNode.valueOf(rawBody);
        }
        if (rawBody == null || rawBody.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.debug("[HTTP] Webhook body declared JSON but did not parse: {}", e.getOriginalMessage());
            return TextNode.valueOf(rawBody);
        }
    }

    private static String sourceIp(HttpServerExchange exchange) {
        String forwarded = exchange.getRequestHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress source = exchange.getSourceAddress();
        return source == null || source.getAddress() == null ? null : source.getAddress().getHostAddress();
    }
}
