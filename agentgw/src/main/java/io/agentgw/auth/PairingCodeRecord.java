package io.agentgw.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Persisted pairing code. Only the salted digest of the plaintext code is kept.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairingCodeRecord(
    String id,
    String salt,
    String secretHash,
    String label,
    Instant createdAt,
    Instant expiresAt,
    Instant usedAt
) {
    /**
     * Live iff never consumed and not yet expired.
     */
    @JsonIgnore
    public boolean isLive(Instant now) {
        return usedAt == null && expiresAt != null && now.isBefore(expiresAt);
    }

    public PairingCodeRecord withUsedAt(Instant at) {
        return new PairingCodeRecord(id, salt, secretHash, label, createdAt, expiresAt, at);
    }
}
