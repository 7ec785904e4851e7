package io.agentgw.daemon;

import java.util.List;

/**
 * Operating-system process operations used by the daemon lifecycle.
 */
public interface ProcessSupervisor {

    long currentPid();

    boolean isAlive(long pid);

    /**
     * Graceful termination request (SIGTERM on POSIX). Returns false if the process was not found.
     */
    boolean terminate(long pid);

    /**
     * Forced termination (SIGKILL on POSIX). Returns false if the process was not found.
     */
    boolean kill(long pid);

    /**
     * Pids of processes listening on the given TCP port, excluding this process.
     */
    List<Long> findPortHolders(int port);
}
