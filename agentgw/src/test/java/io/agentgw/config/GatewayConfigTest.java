package io.agentgw.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    private static GatewayConfig config(Path workDir) {
        return new GatewayConfig(workDir, "127.0.0.1", 7788, null, true,
            Duration.ofMillis(500), Duration.ofSeconds(6), Duration.ofSeconds(8), "0.1.0");
    }

    @Test
    void testStateFilesLiveUnderWorkDir() {
        GatewayConfig config = config(Path.of("/work"));

        assertEquals(Path.of("/work/.agentgw/gateway"), config.stateDir());
        assertEquals(Path.of("/work/.agentgw/gateway/gateway.pid"), config.pidFile());
        assertEquals(Path.of("/work/.agentgw/gateway/gateway-state.json"), config.stateFile());
        assertEquals(Path.of("/work/.agentgw/gateway/gateway-auth.json"), config.authFile());
        assertEquals(Path.of("/work/.agentgw/gateway/gateway.log"), config.logFile());
        assertEquals("", config.staticAuthToken(), "Missing static token becomes empty");
    }

    @Test
    void testWithEndpointOverridesOnlyGivenValues() {
        GatewayConfig base = config(Path.of("/work"));

        GatewayConfig overridden = base.withEndpoint("0.0.0.0", 9000);
        GatewayConfig untouched = base.withEndpoint(" ", null);

        assertEquals("0.0.0.0", overridden.host());
        assertEquals(9000, overridden.port());
        assertEquals(base, untouched);
    }

    @Test
    void testRejectsInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> config(Path.of("/work")).withEndpoint(null, 70000));
    }
}
