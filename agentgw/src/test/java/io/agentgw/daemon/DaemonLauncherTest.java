package io.agentgw.daemon;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DaemonLauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void testDaemonCommandLine() {
        List<String> command = DaemonLauncher.command("/opt/jdk/bin/java", "a.jar:b.jar", "0.0.0.0", 9000);

        assertEquals(List.of("/opt/jdk/bin/java", "-cp", "a.jar:b.jar", "io.agentgw.bootstrap.App",
            "gateway", "daemon", "--host", "0.0.0.0", "--port", "9000"), command);
    }

    @Test
    void testTailLog() throws Exception {
        Path log = tempDir.resolve("gateway.log");
        Files.writeString(log, IntStream.rangeClosed(1, 50).mapToObj(i -> "line " + i).collect(Collectors.joining("\n")));

        List<String> tail = DaemonLauncher.tailLog(log, 3);

        assertEquals(List.of("line 48", "line 49", "line 50"), tail);
        assertTrue(DaemonLauncher.tailLog(tempDir.resolve("missing.log"), 3).isEmpty());
    }
}
