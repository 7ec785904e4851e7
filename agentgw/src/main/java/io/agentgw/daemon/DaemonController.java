package io.agentgw.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Answers "is the daemon running, and where" from the PID file and OS liveness, and stops it.
 * The daemon record is attached as context but never decides the verdict.
 */
public final class DaemonController {
    private static final Logger log = LoggerFactory.getLogger(DaemonController.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(120);
    private static final Duration KILL_WAIT = Duration.ofSeconds(2);

    private final DaemonStateStore store;
    private final ProcessSupervisor supervisor;
    private final Sleeper sleeper;

    public DaemonController(DaemonStateStore store, ProcessSupervisor supervisor) {
        this(store, supervisor, Sleeper.SYSTEM);
    }

    public DaemonController(DaemonStateStore store, ProcessSupervisor supervisor, Sleeper sleeper) {
        this.store = store;
        this.supervisor = supervisor;
        this.sleeper = sleeper;
    }

    public DaemonStatus status() {
        OptionalLong pid = store.readPid();
        DaemonRecord record = store.readRecord().orElse(null);
        if (pid.isEmpty()) {
            return new DaemonStatus(false, null, record);
        }
        return new DaemonStatus(supervisor.isAlive(pid.getAsLong()), pid.getAsLong(), record);
    }

    /**
     * Graceful stop with bounded wait, escalating to a forced kill. Persisted state is cleared on
     * every path.
     */
    public StopOutcome stop(Duration gracefulTimeout) {
        OptionalLong recorded = store.readPid();
        try {
            if (recorded.isEmpty() || !supervisor.isAlive(recorded.getAsLong())) {
                return StopOutcome.ALREADY_STOPPED;
            }
            return terminate(recorded.getAsLong(), gracefulTimeout);
        } catch (ProcessNotRespondingException e) {
            log.error("[DAEMON] {}", e.getMessage());
            return StopOutcome.NOT_RESPONDING;
        } finally {
            store.clear();
        }
    }

    /**
     * SIGTERM, bounded wait, SIGKILL, bounded wait.
     *
     * @throws ProcessNotRespondingException if the process is still alive after the forced kill
     */
    public StopOutcome terminate(long pid, Duration gracefulTimeout) {
        log.info("[DAEMON] Stopping gateway pid {}", pid);
        supervisor.terminate(pid);
        if (waitForExit(pid, gracefulTimeout)) {
            return StopOutcome.STOPPED;
        }

        log.warn("[DAEMON] pid {} did not exit within {} ms, forcing", pid, gracefulTimeout.toMillis());
        supervisor.kill(pid);
        if (waitForExit(pid, KILL_WAIT)) {
            return StopOutcome.KILLED;
        }
        throw new ProcessNotRespondingException(pid, "Process survived forced termination");
    }

    /**
     * Polls the lifecycle store until a live daemon has written its record, or the timeout elapses.
     */
    public Optional<DaemonRecord> waitForStart(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        do {
            DaemonStatus status = status();
            if (status.running() && status.record() != null) {
                return Optional.of(status.record());
            }
            if (!pause()) {
                break;
            }
        } while (System.nanoTime() < deadline);
        return Optional.empty();
    }

    boolean waitForExit(long pid, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (!supervisor.isAlive(pid)) {
                return true;
            }
            if (!pause()) {
                break;
            }
        }
        return !supervisor.isAlive(pid);
    }

    private boolean pause() {
        try {
            sleeper.sleep(POLL_INTERVAL);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
