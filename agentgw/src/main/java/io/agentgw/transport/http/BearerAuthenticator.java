package io.agentgw.transport.http;

import io.agentgw.auth.AuthClient;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.SecretDigests;
import io.agentgw.metrics.GatewayMetrics;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.Deque;
import java.util.Optional;

/**
 * Bearer check for {@code /rpc} and registered routes. Accepts the configured static gateway token
 * (constant-time compare) or any active issued access token.
 */
public final class BearerAuthenticator {
    private static final String BEARER_PREFIX = "Bearer ";

    private final String staticToken;
    private final CredentialManager credentials;
    private final GatewayMetrics metrics;

    public BearerAuthenticator(String staticToken, CredentialManager credentials, GatewayMetrics metrics) {
        this.staticToken = staticToken == null ? "" : staticToken.trim();
        this.credentials = credentials;
        this.metrics = metrics;
    }

    public Optional<GatewayCallContext> authenticate(HttpServerExchange exchange) {
        String token = extractToken(exchange);
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        if (!staticToken.isEmpty() && SecretDigests.constantTimeEquals(staticToken, token)) {
            metrics.recordAuth("static", true);
            return Optional.of(GatewayCallContext.forStaticToken());
        }
        Optional<AuthClient> client = credentials.authenticate(token);
        metrics.recordAuth("bearer", client.isPresent());
        return client.map(c -> new GatewayCallContext(c.id(), c.label(), false));
    }

    /**
     * Token from {@code Authorization: Bearer <token>}, falling back to {@code ?token=}.
     */
    static String extractToken(HttpServerExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        Deque<String> query = exchange.getQueryParameters().get("token");
        if (query != null && !query.isEmpty()) {
            return query.getFirst().trim();
        }
        return null;
    }
}
