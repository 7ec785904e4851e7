package io.agentgw.daemon;

public enum StopOutcome {
    /** No PID file, or the recorded process was already gone. */
    ALREADY_STOPPED,
    /** Exited within the graceful window. */
    STOPPED,
    /** Needed the forced kill. */
    KILLED,
    /** Survived the forced kill too; local state was cleared anyway. */
    NOT_RESPONDING
}
