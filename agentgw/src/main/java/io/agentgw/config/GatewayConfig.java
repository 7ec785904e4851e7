package io.agentgw.config;

import io.agentgw.util.Env;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Effective gateway settings. Built once from the environment, then narrowed by CLI flags.
 *
 * <p>All durable files live under {@link #stateDir()}: the PID file, the daemon record,
 * the credential store and the detached daemon's log.
 */
public record GatewayConfig(
    Path workDir,
    String host,
    int port,
    String staticAuthToken,
    boolean eventsRequireAuth,
    Duration reclaimGrace,
    Duration stopTimeout,
    Duration startTimeout,
    String version
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 7788;
    public static final String DEFAULT_VERSION = "0.1.0";

    public GatewayConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        staticAuthToken = staticAuthToken == null ? "" : staticAuthToken.trim();
    }

    public static GatewayConfig fromEnv() {
        return new GatewayConfig(
            Env.getPath("AGENTGW_WORKDIR", Paths.get("").toAbsolutePath()),
            Env.get("GATEWAY_HOST", DEFAULT_HOST),
            Env.getInt("GATEWAY_PORT", DEFAULT_PORT),
            Env.get("GATEWAY_AUTH_TOKEN", ""),
            Env.getBool("GATEWAY_EVENTS_REQUIRE_AUTH", true),
            Duration.ofMillis(Env.getLong("GATEWAY_RECLAIM_GRACE_MS", 500)),
            Duration.ofMillis(Env.getLong("GATEWAY_STOP_TIMEOUT_MS", 6_000)),
            Duration.ofMillis(Env.getLong("GATEWAY_START_TIMEOUT_MS", 8_000)),
            Env.get("GATEWAY_VERSION", DEFAULT_VERSION)
        );
    }

    public GatewayConfig withEndpoint(String newHost, Integer newPort) {
        return new GatewayConfig(workDir,
            newHost == null || newHost.isBlank() ? host : newHost.trim(),
            newPort == null ? port : newPort,
            staticAuthToken, eventsRequireAuth, reclaimGrace, stopTimeout, startTimeout, version);
    }

    public Path stateDir() {
        return workDir.resolve(".agentgw").resolve("gateway");
    }

    public Path pidFile() {
        return stateDir().resolve("gateway.pid");
    }

    public Path stateFile() {
        return stateDir().resolve("gateway-state.json");
    }

    public Path authFile() {
        return stateDir().resolve("gateway-auth.json");
    }

    public Path logFile() {
        return stateDir().resolve("gateway.log");
    }
}
