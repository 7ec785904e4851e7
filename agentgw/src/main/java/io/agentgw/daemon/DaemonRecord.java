package io.agentgw.daemon;

import java.time.Instant;

/**
 * Advisory description of the running daemon. Never used to decide liveness on its own.
 */
public record DaemonRecord(long pid, Instant startedAt, String host, int port, String version) {

    public String wsEndpoint() {
        return "ws://" + host + ":" + port + "/ws";
    }
}
