package io.agentgw.auth;

import java.time.Instant;

/**
 * Identity of an authenticated client as exposed to the transport layer.
 */
public record AuthClient(String id, String label, Instant tokenIssuedAt) {
}
