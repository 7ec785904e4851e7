package io.agentgw.daemon;

import io.agentgw.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Spawns the gateway as a detached JVM running {@code gateway daemon} and waits for it to
 * report readiness through the lifecycle store.
 */
public final class DaemonLauncher {
    private static final Logger log = LoggerFactory.getLogger(DaemonLauncher.class);

    static final String MAIN_CLASS = "io.agentgw.bootstrap.App";

    private final GatewayConfig config;
    private final DaemonController controller;

    public DaemonLauncher(GatewayConfig config, DaemonController controller) {
        this.config = config;
        this.controller = controller;
    }

    /**
     * @return the record the daemon wrote once bound
     * @throws DaemonStartException if the process cannot be spawned or does not report in time;
     *                              a spawned process is terminated in that case
     */
    public DaemonRecord launch() {
        Process process = spawn();
        Optional<DaemonRecord> record = controller.waitForStart(config.startTimeout());
        if (record.isPresent()) {
            return record.get();
        }
        if (process.isAlive()) {
            log.warn("[DAEMON] Terminating unresponsive daemon pid {}", process.pid());
            process.destroy();
        }
        throw new DaemonStartException("Gateway daemon did not report readiness within "
            + config.startTimeout().toMillis() + " ms");
    }

    Process spawn() {
        List<String> command = command(javaExecutable(), System.getProperty("java.class.path"),
            config.host(), config.port());
        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(config.workDir().toFile())
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(config.logFile().toFile()))
            .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        builder.environment().put("AGENTGW_WORKDIR", config.workDir().toAbsolutePath().toString());
        try {
            Files.createDirectories(config.stateDir());
            Process process = builder.start();
            log.info("[DAEMON] Spawned gateway daemon pid {}", process.pid());
            return process;
        } catch (IOException e) {
            throw new DaemonStartException("Failed to spawn gateway daemon: " + e.getMessage(), e);
        }
    }

    static List<String> command(String javaBin, String classpath, String host, int port) {
        List<String> command = new ArrayList<>();
        command.add(javaBin);
        command.add("-cp");
        command.add(classpath);
        command.add(MAIN_CLASS);
        command.add("gateway");
        command.add("daemon");
        command.add("--host");
        command.add(host);
        command.add("--port");
        command.add(String.valueOf(port));
        return command;
    }

    /**
     * Last {@code lines} lines of the daemon log, empty when the log does not exist.
     */
    public static List<String> tailLog(Path logFile, int lines) {
        try {
            List<String> all = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            return all.subList(Math.max(0, all.size() - lines), all.size());
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            log.warn("[DAEMON] Could not read {}: {}", logFile, e.toString());
            return List.of();
        }
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
            .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        return new File(windows ? "NUL" : "/dev/null");
    }
}
