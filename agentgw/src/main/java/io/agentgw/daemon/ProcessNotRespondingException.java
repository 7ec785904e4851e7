package io.agentgw.daemon;

import io.agentgw.GatewayException;

/**
 * A process survived both the graceful and the forced termination deadline.
 */
public class ProcessNotRespondingException extends GatewayException {

    private final long pid;

    public ProcessNotRespondingException(long pid, String message) {
        super(String.format("[pid %d] %s", pid, message));
        this.pid = pid;
    }

    public long getPid() {
        return pid;
    }
}
