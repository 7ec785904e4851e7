package io.agentgw.auth;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialSummary(int activeTokens, int pendingPairingCodes, Instant latestPairingExpiry) {
}
