package io.agentgw.auth;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of the credential store: {@code {version, pairingCodes[], tokens[]}}.
 */
public record CredentialStoreFile(
    int version,
    List<PairingCodeRecord> pairingCodes,
    List<AccessTokenRecord> tokens
) {
    public static final int CURRENT_VERSION = 1;

    public CredentialStoreFile {
        // Only version 1 exists; anything else read from disk is treated as 1.
        version = CURRENT_VERSION;
        pairingCodes = pairingCodes == null ? new ArrayList<>() : new ArrayList<>(pairingCodes);
        tokens = tokens == null ? new ArrayList<>() : new ArrayList<>(tokens);
        // Null elements and records missing their identity or digest cannot match anything.
        pairingCodes.removeIf(r -> r == null || isBlank(r.id()) || isBlank(r.salt()) || isBlank(r.secretHash()));
        tokens.removeIf(r -> r == null || isBlank(r.id()) || isBlank(r.salt()) || isBlank(r.secretHash())
            || r.createdAt() == null);
    }

    public int recordCount() {
        return pairingCodes.size() + tokens.size();
    }

    public static CredentialStoreFile empty() {
        return new CredentialStoreFile(CURRENT_VERSION, List.of(), List.of());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
