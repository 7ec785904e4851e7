package io.agentgw.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Persisted access token. Only the salted digest of the bearer value is kept.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessTokenRecord(
    String id,
    String salt,
    String secretHash,
    String label,
    Instant createdAt,
    Instant lastUsedAt,
    Instant revokedAt
) {
    @JsonIgnore
    public boolean isActive() {
        return revokedAt == null;
    }

    public AccessTokenRecord withLastUsedAt(Instant at) {
        return new AccessTokenRecord(id, salt, secretHash, label, createdAt, at, revokedAt);
    }

    public AccessTokenRecord withRevokedAt(Instant at) {
        return new AccessTokenRecord(id, salt, secretHash, label, createdAt, lastUsedAt, at);
    }

    AuthClient toClient() {
        return new AuthClient(id, label, createdAt);
    }
}
