package io.agentgw.daemon;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DaemonController.
 *
 * Tests:
 * - Status decided by PID file and liveness only
 * - Graceful stop, forced kill, unkillable process
 * - State cleared on every stop path
 * - Waiting for a daemon to report in
 */
@ExtendWith(MockitoExtension.class)
class DaemonControllerTest {

    private static final Sleeper SHORT_SLEEP = duration -> Thread.sleep(5);

    @TempDir
    Path tempDir;

    @Mock
    ProcessSupervisor supervisor;

    private DaemonStateStore store;
    private DaemonController controller;

    @BeforeEach
    void setUp() {
        store = new DaemonStateStore(tempDir.resolve("gateway.pid"), tempDir.resolve("gateway-state.json"));
        controller = new DaemonController(store, supervisor, SHORT_SLEEP);
    }

    @Test
    void testStatusWithoutPidFileIgnoresRecord() {
        store.writeRecord(record(555));

        DaemonStatus status = controller.status();

        assertFalse(status.running(), "No PID file means not running, whatever the record says");
        assertNull(status.pid());
        assertNotNull(status.record(), "Record is still attached as context");
        verifyNoInteractions(supervisor);
    }

    @Test
    void testStatusWithDeadPid() {
        store.writePid(555);
        when(supervisor.isAlive(555)).thenReturn(false);

        DaemonStatus status = controller.status();

        assertFalse(status.running());
        assertEquals(555L, status.pid());
        assertTrue(Files.exists(tempDir.resolve("gateway.pid")), "Status does not clear stale files");
    }

    @Test
    void testStatusWithLivePid() {
        store.writePid(555);
        store.writeRecord(record(555));
        when(supervisor.isAlive(555)).thenReturn(true);

        DaemonStatus status = controller.status();

        assertTrue(status.running());
        assertEquals(7788, status.record().port());
    }

    @Test
    void testStopWhenNothingRecorded() {
        assertEquals(StopOutcome.ALREADY_STOPPED, controller.stop(Duration.ofSeconds(1)));
        verify(supervisor, never()).terminate(anyLong());
    }

    @Test
    void testStopStaleProcessClearsState() {
        store.writePid(555);
        store.writeRecord(record(555));
        when(supervisor.isAlive(555)).thenReturn(false);

        assertEquals(StopOutcome.ALREADY_STOPPED, controller.stop(Duration.ofSeconds(1)));
        assertTrue(store.readPid().isEmpty());
        assertTrue(store.readRecord().isEmpty());
    }

    @Test
    void testGracefulStop() {
        store.writePid(555);
        when(supervisor.isAlive(555)).thenReturn(true, false);

        assertEquals(StopOutcome.STOPPED, controller.stop(Duration.ofSeconds(1)));

        verify(supervisor).terminate(555);
        verify(supervisor, never()).kill(anyLong());
        assertTrue(store.readPid().isEmpty());
    }

    @Test
    void testEscalatesToKill() {
        store.writePid(555);
        boolean[] killed = {false};
        when(supervisor.isAlive(555)).thenAnswer(inv -> !killed[0]);
        when(supervisor.kill(555)).thenAnswer(inv -> {
            killed[0] = true;
            return true;
        });

        assertEquals(StopOutcome.KILLED, controller.stop(Duration.ofMillis(300)));

        verify(supervisor).terminate(555);
        verify(supervisor).kill(555);
        assertTrue(store.readPid().isEmpty());
    }

    @Test
    void testUnkillableProcessStillClearsState() {
        store.writePid(555);
        store.writeRecord(record(555));
        when(supervisor.isAlive(555)).thenReturn(true);

        assertEquals(StopOutcome.NOT_RESPONDING, controller.stop(Duration.ofMillis(200)));

        assertTrue(store.readPid().isEmpty(), "State is cleared even when the process survives");
        assertTrue(store.readRecord().isEmpty());
    }

    @Test
    void testTerminateThrowsWhenProcessSurvives() {
        when(supervisor.isAlive(777)).thenReturn(true);

        ProcessNotRespondingException e = assertThrows(ProcessNotRespondingException.class,
            () -> controller.terminate(777, Duration.ofMillis(100)));
        assertEquals(777, e.getPid());
    }

    @Test
    void testWaitForStartReturnsRecord() {
        store.writePid(555);
        store.writeRecord(record(555));
        when(supervisor.isAlive(555)).thenReturn(true);

        assertEquals(555, controller.waitForStart(Duration.ofSeconds(1)).orElseThrow().pid());
    }

    @Test
    void testWaitForStartTimesOut() {
        assertTrue(controller.waitForStart(Duration.ofMillis(50)).isEmpty());
    }

    private static DaemonRecord record(long pid) {
        return new DaemonRecord(pid, Instant.parse("2025-01-01T10:00:00Z"), "127.0.0.1", 7788, "0.1.0");
    }
}
