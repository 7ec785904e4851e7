package io.agentgw.transport.ws;

import io.agentgw.auth.AuthClient;

import java.time.Instant;

/**
 * Per-socket protocol state. Created on connect, discarded on close, never persisted.
 * {@code subscribed} and {@code authorized} are independent.
 */
public final class ConnectionSession {
    private final String connectionId;
    private final Instant connectedAt;

    private volatile boolean subscribed;
    private volatile boolean authorized;
    private volatile AuthClient client;
    private volatile String token;

    public ConnectionSession(String connectionId, Instant connectedAt) {
        this.connectionId = connectionId;
        this.connectedAt = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isSubscribed() {
        return subscribed;
    }

    public void subscribe() {
        this.subscribed = true;
    }

    public boolean isAuthorized() {
        return authorized;
    }

    public AuthClient getClient() {
        return client;
    }

    /**
     * Bearer token this socket authenticated with, kept for {@code auth.rotate}.
     */
    String getToken() {
        return token;
    }

    public String getClientId() {
        AuthClient current = client;
        return current == null ? null : current.id();
    }

    void authorize(AuthClient client, String token) {
        this.client = client;
        this.token = token;
        this.authorized = true;
    }

    @Override
    public String toString() {
        return "ConnectionSession[" + connectionId + ", authorized=" + authorized
            + ", subscribed=" + subscribed + ", client=" + getClientId() + "]";
    }
}
