package io.agentgw.bootstrap;

import io.agentgw.GatewayException;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.CredentialStore;
import io.agentgw.config.GatewayConfig;
import io.agentgw.daemon.BindRecovery;
import io.agentgw.daemon.DaemonRecord;
import io.agentgw.daemon.DaemonStateStore;
import io.agentgw.daemon.OsProcessSupervisor;
import io.agentgw.daemon.ProcessSupervisor;
import io.agentgw.engine.EchoGatewayHandlers;
import io.agentgw.engine.GatewayEngineFactory;
import io.agentgw.engine.GatewayEventBus;
import io.agentgw.engine.GatewayHandlers;
import io.agentgw.transport.GatewayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

/**
 * Foreground gateway process: bind with recovery, publish PID file and daemon record, serve
 * until the JVM is asked to exit.
 */
public final class GatewayDaemon {
    private static final Logger log = LoggerFactory.getLogger(GatewayDaemon.class);

    private final GatewayConfig config;
    private final ProcessSupervisor supervisor;
    private final DaemonStateStore stateStore;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private GatewayServer server;

    public GatewayDaemon(GatewayConfig config) {
        this(config, new OsProcessSupervisor());
    }

    GatewayDaemon(GatewayConfig config, ProcessSupervisor supervisor) {
        this.config = config;
        this.supervisor = supervisor;
        this.stateStore = new DaemonStateStore(config.pidFile(), config.stateFile());
    }

    /**
     * Binds and records the daemon. Returns once serving.
     *
     * @throws io.agentgw.daemon.PortConflictException when the single reclaim cycle did not free the port
     */
    public DaemonRecord start() {
        try {
            Files.createDirectories(config.stateDir());
        } catch (IOException e) {
            throw new GatewayException("Cannot create state directory " + config.stateDir(), e);
        }

        // ═══════════════════════════════════════════════════════════════
        // ENGINE
        // ═══════════════════════════════════════════════════════════════
        GatewayEventBus eventBus = new GatewayEventBus();
        GatewayEngineFactory factory = loadEngineFactory();
        GatewayHandlers handlers = factory.createHandlers(eventBus);
        log.info("[DAEMON] Engine: {}", factory.getClass().getName());

        // ═══════════════════════════════════════════════════════════════
        // TRANSPORT
        // ═══════════════════════════════════════════════════════════════
        CredentialManager credentials = new CredentialManager(new CredentialStore(config.authFile()));
        GatewayServer gateway = GatewayServer.builder(config, credentials, handlers)
            .eventBus(eventBus)
            .webhookHandler(factory.createWebhookHandler(eventBus))
            .build();

        new BindRecovery(supervisor, config.reclaimGrace()).bind(config.host(), config.port(), () -> {
            gateway.start();
            return gateway;
        });
        this.server = gateway;

        // ═══════════════════════════════════════════════════════════════
        // LIFECYCLE STATE
        // ═══════════════════════════════════════════════════════════════
        long pid = supervisor.currentPid();
        DaemonRecord record = new DaemonRecord(pid, Instant.now(), config.host(), gateway.port(), config.version());
        stateStore.writePid(pid);
        stateStore.writeRecord(record);

        log.info("═══════════════════════════════════════════════════════");
        log.info("[DAEMON] Gateway daemon started");
        log.info("[DAEMON]   pid:      {}", pid);
        log.info("[DAEMON]   endpoint: {}", record.wsEndpoint());
        log.info("[DAEMON]   state:    {}", config.stateDir());
        log.info("═══════════════════════════════════════════════════════");
        return record;
    }

    /**
     * Starts, installs the shutdown hook and blocks until shutdown.
     */
    public void run() throws InterruptedException {
        start();
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "gateway-shutdown"));
        stopped.await();
    }

    /**
     * Stops the listener and clears the lifecycle files if they still describe this process.
     */
    public void shutdown() {
        log.info("[DAEMON] Shutting down gateway");
        if (server != null) {
            server.stop();
        }
        OptionalLong recorded = stateStore.readPid();
        if (recorded.isPresent() && recorded.getAsLong() == supervisor.currentPid()) {
            stateStore.clear();
        }
        stopped.countDown();
    }

    GatewayServer server() {
        return server;
    }

    static GatewayEngineFactory loadEngineFactory() {
        return ServiceLoader.load(GatewayEngineFactory.class)
            .findFirst()
            .orElseGet(EchoGatewayHandlers.Factory::new);
    }
}
