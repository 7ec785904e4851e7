package io.agentgw.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessSupervisor} backed by {@link ProcessHandle} and, for port lookups, {@code lsof}
 * with {@code fuser} as fallback.
 */
public final class OsProcessSupervisor implements ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(OsProcessSupervisor.class);
    private static final long LOOKUP_TIMEOUT_SECONDS = 3;

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean terminate(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.isPresent() && handle.get().destroy();
    }

    @Override
    public boolean kill(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.isPresent() && handle.get().destroyForcibly();
    }

    @Override
    public List<Long> findPortHolders(int port) {
        Set<Long> pids = new LinkedHashSet<>(run(null, "lsof", "-t", "-iTCP:" + port, "-sTCP:LISTEN"));
        if (pids.isEmpty()) {
            pids.addAll(run(port, "fuser", port + "/tcp"));
        }
        pids.remove(currentPid());
        return new ArrayList<>(pids);
    }

    /**
     * Runs a lookup command and collects every integer token of its output, skipping the port
     * number when the tool echoes it back ({@code fuser}). A missing binary yields an empty list.
     */
    private static List<Long> run(Integer echoedPort, String... command) {
        List<Long> pids = new ArrayList<>();
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            log.debug("[DAEMON] {} unavailable: {}", command[0], e.getMessage());
            return pids;
        }
        try (InputStream in = process.getInputStream()) {
            if (!process.waitFor(LOOKUP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("[DAEMON] {} timed out", command[0]);
                return pids;
            }
            String output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            String portText = echoedPort == null ? null : String.valueOf(echoedPort);
            for (String token : output.split("[^0-9]+")) {
                if (!token.isEmpty() && token.length() < 19 && !token.equals(portText)) {
                    pids.add(Long.parseLong(token));
                }
            }
        } catch (IOException e) {
            log.debug("[DAEMON] Reading {} output failed: {}", command[0], e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return pids;
    }
}
