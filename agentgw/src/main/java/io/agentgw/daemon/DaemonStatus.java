package io.agentgw.daemon;

/**
 * Liveness verdict plus whatever advisory record was found alongside it.
 *
 * @param running true only when the PID file names a live process
 * @param pid     pid read from the PID file, or null when there is none
 * @param record  last written daemon record, or null
 */
public record DaemonStatus(boolean running, Long pid, DaemonRecord record) {
}
