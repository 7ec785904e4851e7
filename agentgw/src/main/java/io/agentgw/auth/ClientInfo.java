package io.agentgw.auth;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only view of an active client for operator listings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientInfo(String id, String label, Instant tokenIssuedAt, Instant lastUsedAt) {
}
