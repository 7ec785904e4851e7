package io.agentgw.daemon;

import io.agentgw.GatewayException;

/**
 * Bind failed and the single reclaim-and-retry cycle did not free the port.
 */
public class PortConflictException extends GatewayException {

    private final String host;
    private final int port;

    public PortConflictException(String host, int port, String message) {
        super(String.format("[%s:%d] %s", host, port, message));
        this.host = host;
        this.port = port;
    }

    public PortConflictException(String host, int port, String message, Throwable cause) {
        super(String.format("[%s:%d] %s", host, port, message), cause);
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }
}
