package io.agentgw.cli;

import io.agentgw.auth.CredentialManager;
import io.agentgw.auth.CredentialStore;
import io.agentgw.auth.IssuedToken;
import io.agentgw.config.GatewayConfig;
import io.agentgw.daemon.DaemonRecord;
import io.agentgw.daemon.DaemonStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the gateway CLI subcommands that do not spawn a process.
 *
 * Tests:
 * - pair prints a code that the credential store accepts
 * - clients lists paired clients and reports an empty store
 * - revoke exit codes for known and unknown clients
 * - status reports not running and clears a stale pid
 * - stop with nothing running
 * - out-of-range ports are usage errors, not stack traces
 */
class GatewayCommandTest {

    /** Above the Linux pid_max ceiling, so never a live process. */
    private static final long DEAD_PID = 999_999_999L;

    @TempDir
    Path tempDir;

    private GatewayConfig config;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        config = new GatewayConfig(tempDir, "127.0.0.1", 7788, "", true,
            Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ofSeconds(1), "9.9.9");
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new GatewayCommand(config));
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    @Test
    void testPairPrintsUsableCode() {
        int exit = cli.execute("pair", "--label", "laptop");

        assertEquals(0, exit);
        String printed = out.toString();
        assertTrue(printed.contains("label:   laptop"));

        String code = printed.lines()
            .filter(line -> line.startsWith("Pairing code: "))
            .map(line -> line.substring("Pairing code: ".length()).trim())
            .findFirst()
            .orElseThrow();
        IssuedToken token = credentials().consumePairingCode(code).orElseThrow();
        assertEquals("laptop", token.client().label());
    }

    @Test
    void testClientsEmpty() {
        assertEquals(0, cli.execute("clients"));
        assertTrue(out.toString().contains("No paired clients"));
    }

    @Test
    void testClientsListsPairedClient() {
        IssuedToken token = pairClient("desktop");

        assertEquals(0, cli.execute("clients"));

        String printed = out.toString();
        assertTrue(printed.contains(token.client().id()));
        assertTrue(printed.contains("desktop"));
        assertFalse(printed.contains(token.token()), "Tokens are never printed");
    }

    @Test
    void testRevoke() {
        IssuedToken token = pairClient("phone");

        assertEquals(0, cli.execute("revoke", token.client().id()));
        assertTrue(out.toString().contains("Revoked " + token.client().id()));
        assertTrue(credentials().authenticate(token.token()).isEmpty());

        assertEquals(1, cli.execute("revoke", token.client().id()));
        assertTrue(err.toString().contains("No active client"));
    }

    @Test
    void testStatusNotRunning() {
        credentials().createPairingCode("pending");

        assertEquals(0, cli.execute("status"));

        String printed = out.toString();
        assertTrue(printed.contains("Gateway: not running"));
        assertTrue(printed.contains("Clients: 0 active, 1 pending pairing code(s)"));
    }

    @Test
    void testStatusClearsStalePid() throws Exception {
        DaemonStateStore store = new DaemonStateStore(config.pidFile(), config.stateFile());
        store.writePid(DEAD_PID);
        store.writeRecord(new DaemonRecord(DEAD_PID, Instant.now(), "127.0.0.1", 7788, "9.9.9"));

        assertEquals(0, cli.execute("status"));

        assertTrue(out.toString().contains("cleared stale state for pid " + DEAD_PID));
        assertFalse(Files.exists(config.pidFile()));
        assertFalse(Files.exists(config.stateFile()));
    }

    @Test
    void testStopWhenNotRunning() {
        assertEquals(0, cli.execute("stop"));
        assertTrue(out.toString().contains("Gateway is not running"));
    }

    @Test
    void testStartRejectsOutOfRangePort() {
        int exit = cli.execute("start", "--port", "70000");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        assertTrue(err.toString().contains("port out of range: 70000"), err.toString());
        assertFalse(err.toString().contains("\tat "), "No stack trace for a bad flag");
        assertFalse(Files.exists(config.logFile()), "Nothing is launched");
    }

    @Test
    void testOutOfRangePortFromEnvironment() {
        System.setProperty("GATEWAY_PORT", "70000");
        try {
            CommandLine fromEnv = new CommandLine(new GatewayCommand());
            fromEnv.setOut(new PrintWriter(out, true));
            fromEnv.setErr(new PrintWriter(err, true));

            assertEquals(CommandLine.ExitCode.USAGE, fromEnv.execute("status"));
            assertTrue(err.toString().contains("port out of range: 70000"), err.toString());
            assertFalse(err.toString().contains("\tat "));
        } finally {
            System.clearProperty("GATEWAY_PORT");
        }
    }

    private CredentialManager credentials() {
        return new CredentialManager(new CredentialStore(config.authFile()));
    }

    private IssuedToken pairClient(String label) {
        CredentialManager credentials = credentials();
        return credentials.consumePairingCode(credentials.createPairingCode(label).code()).orElseThrow();
    }
}
