package io.agentgw.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.CredentialStore;
import io.agentgw.auth.IssuedToken;
import io.agentgw.config.GatewayConfig;
import io.agentgw.engine.WebhookPayload;
import io.agentgw.transport.http.GatewayMethodRegistry;
import io.agentgw.transport.http.HttpResponses;
import io.agentgw.transport.http.HttpRouteRegistry;
import io.agentgw.util.Jsons;
import io.undertow.util.PathTemplateMatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the gateway HTTP surface.
 *
 * Tests:
 * - /health without auth
 * - webhook ingress with, without and with a failing handler
 * - /rpc bearer check, validation, method dispatch and handler errors
 * - registered routes and the 401/404 fallback
 * - /metrics export, with and without a name filter
 */
class GatewayHttpTest {

    private static final String STATIC_TOKEN = "static-secret";

    @TempDir
    Path tempDir;

    private CredentialManager credentials;
    private GatewayServer server;
    private HttpClient httpClient;
    private final AtomicReference<WebhookPayload> lastWebhook = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        credentials = new CredentialManager(new CredentialStore(tempDir.resolve("gateway-auth.json")));

        GatewayMethodRegistry methods = new GatewayMethodRegistry()
            .register("jobs.fail", "Always fails", (params, ctx) -> {
                throw new IllegalStateException("job store offline");
            })
            .register("jobs.whoami", "Caller identity", (params, ctx) -> Map.of("clientId", ctx.clientId()));
        HttpRouteRegistry routes = new HttpRouteRegistry()
            .register("GET", "/jobs/{id}", "Job detail", (exchange, ctx) ->
                HttpResponses.json(exchange, 200, Map.of("id",
                    exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("id"),
                    "caller", ctx.clientId())));

        server = GatewayServer.builder(config(), credentials, new ScriptedHandlers())
            .webhookHandler(payload -> {
                lastWebhook.set(payload);
                if ("broken".equals(payload.name())) {
                    throw new IllegalStateException("scheduler down");
                }
                return Map.of("matchedJobs", 2);
            })
            .methods(methods)
            .routes(routes)
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = send(get("/health").build());

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("ok").asBoolean());
        assertEquals("ok", body.path("status").asText());
        assertEquals("127.0.0.1", body.path("host").asText());
        assertEquals(server.port(), body.path("port").asInt());
        assertEquals("9.9.9", body.path("version").asText());
        assertEquals(0, body.path("connections").asInt());
    }

    @Test
    void testWebhookAccepted() throws Exception {
        HttpResponse<String> response = send(post("/webhooks/github", "{\"action\":\"opened\"}")
            .header("Content-Type", "application/json")
            .header("X-GitHub-Event", "pull_request")
            .build());

        assertEquals(202, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("accepted").asBoolean());
        assertEquals("github", body.path("webhook").asText());
        assertEquals(2, body.path("matchedJobs").asInt());

        WebhookPayload payload = lastWebhook.get();
        assertEquals("github", payload.name());
        assertEquals("opened", payload.body().path("action").asText());
        assertEquals("{\"action\":\"opened\"}", payload.rawBody());
        assertEquals("pull_request", payload.headers().get("x-github-event"), "Header names are lower-cased");
        assertNotNull(payload.receivedAt());
        assertNotNull(payload.sourceIp());
    }

    @Test
    void testWebhookNonJsonBodyKeptAsText() throws Exception {
        HttpResponse<String> response = send(post("/webhooks/plain", "hello=world")
            .header("Content-Type", "application/x-www-form-urlencoded")
            .build());

        assertEquals(202, response.statusCode());
        assertTrue(lastWebhook.get().body().isTextual());
        assertEquals("hello=world", lastWebhook.get().body().asText());
    }

    @Test
    void testWebhookHandlerFailureStillAccepted() throws Exception {
        HttpResponse<String> response = send(post("/webhooks/broken", "{}")
            .header("Content-Type", "application/json")
            .build());

        assertEquals(202, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("accepted").asBoolean());
        assertEquals("broken", body.path("webhook").asText());
        assertEquals(0, body.path("matchedJobs").asInt());
    }

    @Test
    void testWebhookWithoutHandler() throws Exception {
        server.stop();
        server = GatewayServer.builder(config(), credentials, new ScriptedHandlers()).build();
        server.start();

        HttpResponse<String> response = send(post("/webhooks/anything", "{}").build());

        assertEquals(202, response.statusCode());
        assertEquals(0, json(response).path("matchedJobs").asInt());
    }

    @Test
    void testRpcRequiresBearer() throws Exception {
        HttpResponse<String> missing = send(post("/rpc", "{\"method\":\"gateway.status\"}").build());
        HttpResponse<String> wrong = send(post("/rpc", "{\"method\":\"gateway.status\"}")
            .header("Authorization", "Bearer not-the-secret")
            .build());

        assertEquals(401, missing.statusCode());
        assertEquals(401, wrong.statusCode());
    }

    @Test
    void testRpcWithStaticToken() throws Exception {
        HttpResponse<String> response = send(authorized(post("/rpc",
            "{\"method\":\"gateway.status\",\"requestId\":\"req-1\"}")).build());

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("req-1", body.path("requestId").asText());
        assertTrue(body.path("ok").asBoolean());
        assertEquals(server.port(), body.path("result").path("port").asInt());
        assertEquals("test-model", body.path("result").path("engine").path("model").asText());
    }

    @Test
    void testRpcWithIssuedTokenInQuery() throws Exception {
        IssuedToken token = credentials.consumePairingCode(credentials.createPairingCode("rpc").code()).orElseThrow();

        HttpResponse<String> response = send(post("/rpc?token=" + token.token(), "{\"method\":\"jobs.whoami\"}").build());

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals(token.client().id(), body.path("result").path("clientId").asText());
        assertFalse(body.path("requestId").asText().isBlank(), "requestId is generated when absent");
    }

    @Test
    void testRpcValidationErrors() throws Exception {
        HttpResponse<String> invalidJson = send(authorized(post("/rpc", "{not json")).build());
        HttpResponse<String> missingMethod = send(authorized(post("/rpc", "{\"params\":{}}")).build());
        HttpResponse<String> unknown = send(authorized(post("/rpc", "{\"method\":\"jobs.unknown\"}")).build());

        assertEquals(400, invalidJson.statusCode());
        assertEquals("VALIDATION_ERROR", json(invalidJson).path("error").path("code").asText());
        assertEquals(400, missingMethod.statusCode());
        assertEquals("VALIDATION_ERROR", json(missingMethod).path("error").path("code").asText());
        assertEquals(400, unknown.statusCode());
        assertEquals("METHOD_NOT_FOUND", json(unknown).path("error").path("code").asText());
    }

    @Test
    void testRpcHandlerErrorIsOkFalse() throws Exception {
        HttpResponse<String> response = send(authorized(post("/rpc", "{\"method\":\"jobs.fail\"}")).build());

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertFalse(body.path("ok").asBoolean());
        assertEquals("HANDLER_ERROR", body.path("error").path("code").asText());
        assertEquals("job store offline", body.path("error").path("message").asText());
    }

    @Test
    void testRpcMessageSend() throws Exception {
        HttpResponse<String> response = send(authorized(post("/rpc",
            "{\"method\":\"message.send\",\"params\":{\"message\":\"hi\",\"sessionId\":\"s-1\"}}")).build());

        JsonNode body = json(response);
        assertTrue(body.path("ok").asBoolean());
        assertEquals("reply:hi", body.path("result").path("response").asText());
        assertEquals("s-1", body.path("result").path("sessionId").asText());
    }

    @Test
    void testRegisteredRouteAndFallback() throws Exception {
        HttpResponse<String> unauthorized = send(get("/jobs/42").build());
        HttpResponse<String> route = send(authorized(get("/jobs/42")).build());
        HttpResponse<String> unknownAnonymous = send(get("/nowhere").build());
        HttpResponse<String> unknownAuthorized = send(authorized(get("/nowhere")).build());

        assertEquals(401, unauthorized.statusCode());
        assertEquals(200, route.statusCode());
        assertEquals("42", json(route).path("id").asText());
        assertEquals("static", json(route).path("caller").asText());
        assertEquals(401, unknownAnonymous.statusCode());
        assertEquals(404, unknownAuthorized.statusCode());
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        send(post("/rpc", "{}").build());

        HttpResponse<String> response = send(get("/metrics").build());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        assertTrue(response.body().contains("gateway_rpc_requests_total"));
        assertTrue(response.body().contains("gateway_ws_connections"));
    }

    @Test
    void testMetricsEndpointFiltersByName() throws Exception {
        send(post("/rpc", "{}").build());

        HttpResponse<String> response = send(get("/metrics?name%5B%5D=gateway_rpc_requests_total").build());

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("gateway_rpc_requests_total{outcome=\"unauthorized\""));
        assertFalse(response.body().contains("gateway_ws_connections"));
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder get(String path) {
        return HttpRequest.newBuilder(uri(path)).GET();
    }

    private HttpRequest.Builder post(String path, String body) {
        return HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.ofString(body));
    }

    private static HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        return builder.header("Authorization", "Bearer " + STATIC_TOKEN);
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return Jsons.mapper().readTree(response.body());
    }

    private GatewayConfig config() {
        return new GatewayConfig(tempDir, "127.0.0.1", 0, STATIC_TOKEN, true,
            Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ofSeconds(1), "9.9.9");
    }
}
