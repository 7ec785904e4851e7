package io.agentgw.auth;

import io.agentgw.GatewayException;

import java.nio.file.Path;

/**
 * Thrown when the credential file cannot be written.
 */
public class CredentialStoreException extends GatewayException {

    private final Path file;

    public CredentialStoreException(Path file, String message, Throwable cause) {
        super(String.format("[%s] %s", file, message), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
