package io.agentgw.auth;

import java.time.Instant;

/**
 * A pairing code as handed to the operator, exactly once.
 */
public record PairingCode(String code, String label, Instant expiresAt) {

    @Override
    public String toString() {
        return "PairingCode[label=" + label + ", expiresAt=" + expiresAt + ", code=<redacted>]";
    }
}
