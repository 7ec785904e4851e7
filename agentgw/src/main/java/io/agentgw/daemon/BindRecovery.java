package io.agentgw.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.BindException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Bind-with-recovery: one attempt, and on "address in use" a single cycle of signalling the port
 * holders, waiting a fixed grace period and retrying. There is no further retry.
 */
public final class BindRecovery {
    private static final Logger log = LoggerFactory.getLogger(BindRecovery.class);

    /**
     * One bind attempt. Implementations create fresh listener state on every call.
     */
    @FunctionalInterface
    public interface BindAttempt<T> {
        T bind() throws Exception;
    }

    private final ProcessSupervisor supervisor;
    private final Duration grace;
    private final Sleeper sleeper;

    public BindRecovery(ProcessSupervisor supervisor, Duration grace) {
        this(supervisor, grace, Sleeper.SYSTEM);
    }

    public BindRecovery(ProcessSupervisor supervisor, Duration grace, Sleeper sleeper) {
        this.supervisor = supervisor;
        this.grace = grace;
        this.sleeper = sleeper;
    }

    public <T> T bind(String host, int port, BindAttempt<T> attempt) {
        try {
            return attempt.bind();
        } catch (Exception first) {
            if (!isAddressInUse(first)) {
                throw new PortConflictException(host, port, "Bind failed: " + rootMessage(first), first);
            }
            log.warn("[DAEMON] {}:{} is in use, looking for the holder", host, port);
        }

        List<Long> holders = supervisor.findPortHolders(port);
        if (holders.isEmpty()) {
            throw new PortConflictException(host, port, "Address in use and no holding process could be identified");
        }
        for (Long pid : holders) {
            log.warn("[DAEMON] Sending termination signal to pid {} holding port {}", pid, port);
            supervisor.terminate(pid);
        }

        try {
            sleeper.sleep(grace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortConflictException(host, port, "Interrupted while waiting for port to be released", e);
        }

        try {
            T bound = attempt.bind();
            log.info("[DAEMON] Reclaimed {}:{} after stopping {}", host, port, holders);
            return bound;
        } catch (Exception second) {
            throw new PortConflictException(host, port,
                "Still unable to bind after stopping " + holders + ": " + rootMessage(second), second);
        }
    }

    /**
     * Undertow wraps the socket exception, so the whole cause chain is inspected.
     */
    static boolean isAddressInUse(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof BindException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("address already in use")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
