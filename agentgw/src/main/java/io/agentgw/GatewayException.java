package io.agentgw;

/**
 * Base for failures the gateway reports to its operator rather than to a remote client.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
