package io.agentgw.cli;

import io.agentgw.GatewayException;
import io.agentgw.auth.ClientInfo;
import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.CredentialStore;
import io.agentgw.auth.CredentialSummary;
import io.agentgw.auth.PairingCode;
import io.agentgw.bootstrap.GatewayDaemon;
import io.agentgw.config.GatewayConfig;
import io.agentgw.daemon.DaemonController;
import io.agentgw.daemon.DaemonLauncher;
import io.agentgw.daemon.DaemonRecord;
import io.agentgw.daemon.DaemonStartException;
import io.agentgw.daemon.DaemonStateStore;
import io.agentgw.daemon.DaemonStatus;
import io.agentgw.daemon.OsProcessSupervisor;
import io.agentgw.daemon.PortConflictException;
import io.agentgw.daemon.StopOutcome;
import io.agentgw.util.Env;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "gateway",
        mixinStandardHelpOptions = true,
        versionProvider = GatewayCommand.VersionProvider.class,
        description = "Manage the local gateway daemon and its paired clients",
        subcommands = {
                GatewayCommand.StartCommand.class,
                GatewayCommand.DaemonCommand.class,
                GatewayCommand.StatusCommand.class,
                GatewayCommand.StopCommand.class,
                GatewayCommand.PairCommand.class,
                GatewayCommand.ClientsCommand.class,
                GatewayCommand.RevokeCommand.class,
                CommandLine.HelpCommand.class
        }
)
public final class GatewayCommand implements Runnable {
    static final String BOOTSTRAP_LABEL = "bootstrap-client";
    static final int LOG_TAIL_LINES = 40;

    private final GatewayConfig fixedConfig;

    @Spec
    CommandSpec spec;

    public GatewayCommand() {
        this(null);
    }

    /**
     * @param fixedConfig configuration to use instead of the environment, or null
     */
    GatewayCommand(GatewayConfig fixedConfig) {
        this.fixedConfig = fixedConfig;
    }

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: start | daemon | status | stop | pair | clients | revoke | help");
    }

    GatewayConfig config() {
        return fixedConfig != null ? fixedConfig : GatewayConfig.fromEnv();
    }

    /**
     * Configuration with the endpoint overrides applied. Invalid values (from flags or the
     * environment) are reported as a usage error instead of a stack trace.
     */
    GatewayConfig config(CommandSpec spec, String host, Integer port) {
        try {
            return config().withEndpoint(host, port);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid gateway configuration: " + e.getMessage(), e);
        }
    }

    CredentialManager credentials(GatewayConfig config) {
        return new CredentialManager(new CredentialStore(config.authFile()));
    }

    DaemonStateStore stateStore(GatewayConfig config) {
        return new DaemonStateStore(config.pidFile(), config.stateFile());
    }

    DaemonController controller(GatewayConfig config) {
        return new DaemonController(stateStore(config), new OsProcessSupervisor());
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"agentgw " + Env.get("GATEWAY_VERSION", GatewayConfig.DEFAULT_VERSION)};
        }
    }

    @Command(name = "start", description = "Start the gateway daemon in the background")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--host"}, description = "Bind host (default: GATEWAY_HOST or 127.0.0.1)")
        String host;

        @Option(names = {"--port"}, description = "Bind port (default: GATEWAY_PORT or 7788)")
        Integer port;

        @Override
        public Integer call() throws IOException {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            GatewayConfig config = parent.config(spec, host, port);
            DaemonController controller = parent.controller(config);

            DaemonStatus status = controller.status();
            if (status.running()) {
                err.println("Gateway already running (pid " + status.pid() + ")"
                    + (status.record() == null ? "" : " at " + status.record().wsEndpoint()));
                return 1;
            }
            parent.stateStore(config).clear();
            Files.createDirectories(config.stateDir());
            Files.write(config.logFile(), new byte[0]);

            PairingCode pairing = parent.credentials(config).createPairingCode(BOOTSTRAP_LABEL);
            try {
                DaemonRecord record = new DaemonLauncher(config, controller).launch();
                out.println("Gateway started");
                out.println("  endpoint:     " + record.wsEndpoint());
                out.println("  pid:          " + record.pid());
                out.println("  pairing code: " + pairing.code() + " (label " + pairing.label()
                    + ", expires " + pairing.expiresAt() + ")");
                return 0;
            } catch (DaemonStartException e) {
                err.println(e.getMessage());
                List<String> tail = DaemonLauncher.tailLog(config.logFile(), LOG_TAIL_LINES);
                if (!tail.isEmpty()) {
                    err.println("Last lines of " + config.logFile() + ":");
                    tail.forEach(line -> err.println("  " + line));
                }
                return 1;
            }
        }
    }

    @Command(name = "daemon", description = "Run the gateway in the foreground (used by start)")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--host"}, description = "Bind host")
        String host;

        @Option(names = {"--port"}, description = "Bind port")
        Integer port;

        @Override
        public Integer call() throws InterruptedException {
            GatewayConfig config = parent.config(spec, host, port);
            try {
                new GatewayDaemon(config).run();
                return 0;
            } catch (PortConflictException e) {
                spec.commandLine().getErr().println("Cannot bind " + e.getHost() + ":" + e.getPort() + ": " + e.getMessage());
                return 2;
            } catch (GatewayException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "Show daemon status and credential summary")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            GatewayConfig config = parent.config(spec, null, null);
            DaemonStatus status = parent.controller(config).status();

            if (status.running()) {
                out.println("Gateway: running (pid " + status.pid() + ")");
                DaemonRecord record = status.record();
                if (record != null) {
                    out.println("  endpoint: " + record.wsEndpoint());
                    out.println("  started:  " + record.startedAt());
                    out.println("  version:  " + record.version());
                }
            } else {
                out.println("Gateway: not running");
                if (status.pid() != null) {
                    parent.stateStore(config).clear();
                    out.println("  cleared stale state for pid " + status.pid());
                }
            }

            CredentialSummary summary = parent.credentials(config).getSummary();
            out.println("Clients: " + summary.activeTokens() + " active, "
                + summary.pendingPairingCodes() + " pending pairing code(s)");
            return 0;
        }
    }

    @Command(name = "stop", description = "Stop the gateway daemon")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            GatewayConfig config = parent.config(spec, null, null);
            StopOutcome outcome = parent.controller(config).stop(config.stopTimeout());
            PrintWriter out = spec.commandLine().getOut();
            switch (outcome) {
                case ALREADY_STOPPED -> out.println("Gateway is not running");
                case STOPPED -> out.println("Gateway stopped");
                case KILLED -> out.println("Gateway did not stop in time and was killed");
                case NOT_RESPONDING -> {
                    spec.commandLine().getErr().println("Gateway process did not exit; local state was cleared");
                    return 1;
                }
            }
            return 0;
        }
    }

    @Command(name = "pair", description = "Create a one-time pairing code")
    static final class PairCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--label"}, description = "Label for the client that will pair")
        String label;

        @Override
        public Integer call() {
            PairingCode pairing = parent.credentials(parent.config(spec, null, null)).createPairingCode(label);
            PrintWriter out = spec.commandLine().getOut();
            out.println("Pairing code: " + pairing.code());
            out.println("  label:   " + pairing.label());
            out.println("  expires: " + pairing.expiresAt());
            return 0;
        }
    }

    @Command(name = "clients", description = "List paired clients with an active token")
    static final class ClientsCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            List<ClientInfo> clients = parent.credentials(parent.config(spec, null, null)).listClients();
            PrintWriter out = spec.commandLine().getOut();
            if (clients.isEmpty()) {
                out.println("No paired clients");
                return 0;
            }
            for (ClientInfo client : clients) {
                out.println(client.id() + "  " + client.label() + "  issued " + client.tokenIssuedAt()
                    + (client.lastUsedAt() == null ? "" : "  last used " + client.lastUsedAt()));
            }
            return 0;
        }
    }

    @Command(name = "revoke", description = "Revoke a client's access token")
    static final class RevokeCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Client id (client_...)")
        String clientId;

        @Override
        public Integer call() {
            boolean revoked = parent.credentials(parent.config(spec, null, null)).revokeClient(clientId);
            if (!revoked) {
                spec.commandLine().getErr().println("No active client " + clientId);
                return 1;
            }
            spec.commandLine().getOut().println("Revoked " + clientId);
            return 0;
        }
    }
}
