package io.agentgw.daemon;

import io.agentgw.GatewayException;

/**
 * The detached daemon never reported readiness.
 */
public class DaemonStartException extends GatewayException {

    public DaemonStartException(String message) {
        super(message);
    }

    public DaemonStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
