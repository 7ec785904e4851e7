package io.agentgw.metrics;

import io.prometheus.client.Collector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GatewayMetrics.
 *
 * Tests:
 * - Built-in command names keep their own label
 * - Arbitrary command names collapse into a single unknown series
 * - Broadcast send results are counted per result
 */
class GatewayMetricsTest {

    private GatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new GatewayMetrics();
    }

    @Test
    void testKnownCommandsKeepTheirLabel() {
        for (String command : GatewayMetrics.KNOWN_COMMANDS) {
            assertEquals(command, GatewayMetrics.commandLabel(command));
        }
        assertEquals("unknown", GatewayMetrics.commandLabel(null));
        assertEquals("unknown", GatewayMetrics.commandLabel("MESSAGE.SEND"));
    }

    @Test
    void testArbitraryCommandNamesAreBounded() {
        for (int i = 0; i < 500; i++) {
            metrics.recordCommand("junk-" + i, "unauthorized", -1);
        }
        metrics.recordCommand("status.get", "ok", 0.01);

        assertEquals(500.0, metrics.getRegistry().getSampleValue("gateway_commands_total",
            new String[]{"command", "outcome"}, new String[]{"unknown", "unauthorized"}), 0.0001);
        assertEquals(2, seriesCount("gateway_commands"), "One series per known label plus unknown");
        assertEquals(1, seriesCount("gateway_command_latency_seconds"));
    }

    @Test
    void testBroadcastSendResults() {
        metrics.recordBroadcastSend(GatewayMetrics.SendResult.DELIVERED);
        metrics.recordBroadcastSend(GatewayMetrics.SendResult.DELIVERED);
        metrics.recordBroadcastSend(GatewayMetrics.SendResult.SKIPPED);

        assertEquals(2.0, metrics.broadcastSends(GatewayMetrics.SendResult.DELIVERED), 0.0001);
        assertEquals(1.0, metrics.broadcastSends(GatewayMetrics.SendResult.SKIPPED), 0.0001);
        assertEquals(0.0, metrics.broadcastSends(GatewayMetrics.SendResult.FAILED), 0.0001);
    }

    /**
     * Distinct label sets in a family, ignoring the histogram's le label.
     */
    private long seriesCount(String family) {
        List<Collector.MetricFamilySamples> families = Collections.list(metrics.getRegistry().metricFamilySamples());
        return families.stream()
            .filter(f -> f.name.equals(family))
            .flatMap(f -> f.samples.stream())
            .map(sample -> {
                List<String> values = new ArrayList<>();
                for (int i = 0; i < sample.labelNames.size(); i++) {
                    if (!sample.labelNames.get(i).equals("le")) {
                        values.add(sample.labelValues.get(i));
                    }
                }
                return values;
            })
            .distinct()
            .count();
    }
}
