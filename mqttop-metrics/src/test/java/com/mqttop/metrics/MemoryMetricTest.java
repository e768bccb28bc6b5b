/**
 * 内存指标测试
 *
 * @author zhenglin
 * @date 2025/08/18
 */
package com.mqttop.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.Origin;
import com.mqttop.common.metric.UpdateOutcome;
import com.sun.management.OperatingSystemMXBean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemoryMetricTest {

    private static final long GIB = 1024L * 1024 * 1024;

    @Mock
    private OperatingSystemMXBean os;

    private MemoryMetric metric;

    @BeforeEach
    void setUp() {
        metric = new MemoryMetric(MemoryMetric.DEFAULT_TOPIC, Duration.ofSeconds(2), os);
    }

    @Test
    void testCollect() throws Exception {
        stubMemory(16 * GIB, 4 * GIB, 2 * GIB, GIB);

        assertEquals(UpdateOutcome.Kind.CHANGED, metric.update().getKind());
        assertEquals(UpdateOutcome.Kind.UNCHANGED, metric.update().getKind());

        JsonNode payload = new ObjectMapper().readTree(metric.toPayload());
        assertEquals(16 * GIB, payload.get("total").asLong());
        assertEquals(12 * GIB, payload.get("used").asLong());
        assertEquals(2 * GIB, payload.get("swapTotal").asLong());
        assertEquals(GIB, payload.get("swapUsed").asLong());
    }

    @Test
    void testUsageChange() {
        stubMemory(16 * GIB, 4 * GIB, 0, 0);
        metric.update();

        when(os.getFreeMemorySize()).thenReturn(3 * GIB);

        assertEquals(UpdateOutcome.Kind.CHANGED, metric.update().getKind());
    }

    @Test
    void testUnavailableTotal() {
        when(os.getTotalMemorySize()).thenReturn(0L);

        assertTrue(metric.update().isFailed());
    }

    @Test
    void testDiscoverWithSwap() {
        stubMemory(16 * GIB, 4 * GIB, 2 * GIB, GIB);
        metric.update();

        Discovery discovery = discovery();
        metric.discover(discovery);

        assertEquals(List.of("mqttop_memory", "mqttop_memory_total", "mqttop_memory_used", "mqttop_swap"),
                discovery.getNode("memory"));
        assertEquals(false, discovery.getComponent("mqttop_memory_total").get(ComponentOption.ENABLED_BY_DEFAULT));
    }

    @Test
    void testDiscoverWithoutSwap() {
        stubMemory(16 * GIB, 4 * GIB, 0, 0);
        metric.update();

        Discovery discovery = discovery();
        metric.discover(discovery);

        assertFalse(discovery.getNode("memory").contains("mqttop_swap"));
        assertEquals(3, discovery.getNode("memory").size());
    }

    private void stubMemory(long total, long free, long swapTotal, long swapFree) {
        when(os.getTotalMemorySize()).thenReturn(total);
        when(os.getFreeMemorySize()).thenReturn(free);
        when(os.getTotalSwapSpaceSize()).thenReturn(swapTotal);
        when(os.getFreeSwapSpaceSize()).thenReturn(swapFree);
    }

    private static Discovery discovery() {
        Discovery discovery = new Discovery();
        discovery.setOrigin(Origin.defaultOrigin());
        return discovery;
    }
}
