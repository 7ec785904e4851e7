package io.agentgw.daemon;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DaemonStateStoreTest {

    @TempDir
    Path tempDir;

    private DaemonStateStore store;
    private Path pidFile;
    private Path stateFile;

    @BeforeEach
    void setUp() {
        pidFile = tempDir.resolve("gateway.pid");
        stateFile = tempDir.resolve("gateway-state.json");
        store = new DaemonStateStore(pidFile, stateFile);
    }

    @Test
    void testEmptyStore() {
        assertTrue(store.readPid().isEmpty());
        assertTrue(store.readRecord().isEmpty());
    }

    @Test
    void testPidFileIsOneLine() throws Exception {
        store.writePid(4242);

        assertEquals("4242\n", Files.readString(pidFile));
        assertEquals(4242, store.readPid().getAsLong());
    }

    @Test
    void testRecordRoundTrip() {
        DaemonRecord record = new DaemonRecord(4242, Instant.parse("2025-01-01T10:00:00Z"), "127.0.0.1", 7788, "0.1.0");

        store.writeRecord(record);

        assertEquals(record, store.readRecord().orElseThrow());
        assertEquals("ws://127.0.0.1:7788/ws", record.wsEndpoint());
    }

    @Test
    void testMalformedFilesAreIgnored() throws Exception {
        Files.writeString(pidFile, "not-a-pid");
        Files.writeString(stateFile, "{\"pid\": 0, \"port\": 7788}");

        assertTrue(store.readPid().isEmpty(), "Malformed PID file reads as absent");
        assertTrue(store.readRecord().isEmpty(), "Record with pid 0 is rejected");

        Files.writeString(stateFile, "[broken");
        assertTrue(store.readRecord().isEmpty());
    }

    @Test
    void testClearRemovesBothFiles() {
        store.writePid(1);
        store.writeRecord(new DaemonRecord(1, Instant.now(), "127.0.0.1", 7788, "0.1.0"));

        store.clear();
        store.clear();

        assertFalse(Files.exists(pidFile));
        assertFalse(Files.exists(stateFile));
    }
}
