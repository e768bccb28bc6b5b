/**
 * 轮询指标基类测试
 *
 * @author zhenglin
 * @date 2025/08/18
 */
package com.mqttop.metrics;

import com.mqttop.common.metric.MetricException;
import com.mqttop.common.metric.UpdateOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 轮询指标基类单元测试
 */
class AbstractPollingMetricTest {

    private ScriptedMetric metric;

    @AfterEach
    void tearDown() {
        if (metric != null) {
            metric.stop();
        }
    }

    @Test
    void testFirstTickIsAlwaysChanged() throws Exception {
        metric = new ScriptedMetric(Duration.ofMillis(20));

        metric.start();

        Optional<UpdateOutcome> first = metric.updated().poll(2, TimeUnit.SECONDS);
        assertTrue(first.isPresent());
        assertEquals(UpdateOutcome.Kind.CHANGED, first.get().getKind());
        Optional<UpdateOutcome> second = metric.updated().poll(2, TimeUnit.SECONDS);
        assertEquals(UpdateOutcome.Kind.UNCHANGED, second.orElseThrow().getKind());
        assertTrue(metric.isRunning());
    }

    @Test
    void testScriptedOutcomesArePushed() throws Exception {
        metric = new ScriptedMetric(Duration.ofMillis(20));
        // 第一个结果由启动时的采集消费
        metric.script.add(UpdateOutcome.unchanged());
        metric.script.add(UpdateOutcome.unchanged());
        metric.script.add(UpdateOutcome.rescanned());

        metric.start();

        assertEquals(UpdateOutcome.Kind.CHANGED, metric.updated().poll(2, TimeUnit.SECONDS).orElseThrow().getKind());
        assertEquals(UpdateOutcome.Kind.RESCANNED, metric.updated().poll(2, TimeUnit.SECONDS).orElseThrow().getKind());
    }

    @Test
    void testCollectFailureIsPushedAsFailed() throws Exception {
        metric = new ScriptedMetric(Duration.ofMillis(20));
        metric.start();
        metric.failNext = true;

        UpdateOutcome outcome = null;
        for (int i = 0; i < 10 && (outcome == null || !outcome.isFailed()); i++) {
            outcome = metric.updated().poll(2, TimeUnit.SECONDS).orElseThrow();
        }

        assertNotNull(outcome);
        assertTrue(outcome.isFailed());
        assertTrue(outcome.getCause() instanceof MetricException);
    }

    @Test
    void testInitialCollectFailureFailsStart() {
        metric = new ScriptedMetric(Duration.ofSeconds(1));
        metric.failNext = true;

        assertThrows(MetricException.class, metric::start);
        assertFalse(metric.isRunning());
    }

    @Test
    void testZeroIntervalDoesNotStart() throws Exception {
        metric = new ScriptedMetric(Duration.ZERO);

        metric.start();

        assertFalse(metric.isRunning());
        assertEquals(0, metric.collects.get());
    }

    @Test
    void testStopClosesChannel() throws Exception {
        metric = new ScriptedMetric(Duration.ofSeconds(10));
        metric.start();

        metric.stop();
        metric.stop();

        assertFalse(metric.isRunning());
        assertTrue(metric.updated().isClosed());
        assertTrue(metric.updated().receive().isEmpty());
    }

    @Test
    void testStartAfterStopIsIgnored() throws Exception {
        metric = new ScriptedMetric(Duration.ofSeconds(10));
        metric.stop();

        metric.start();

        assertFalse(metric.isRunning());
        assertEquals(0, metric.collects.get());
    }

    @Test
    void testSetInterval() throws Exception {
        metric = new ScriptedMetric(Duration.ofSeconds(30));
        metric.start();

        metric.setInterval(Duration.ofMillis(20));

        assertEquals(Duration.ofMillis(20), metric.getInterval());
        assertTrue(metric.updated().poll(2, TimeUnit.SECONDS).isPresent());
        assertThrows(IllegalArgumentException.class, () -> metric.setInterval(Duration.ofSeconds(-1)));

        metric.setInterval(Duration.ZERO);
        assertFalse(metric.isRunning());
        assertTrue(metric.updated().isClosed());
    }

    @Test
    void testUpdateAndPayload() throws Exception {
        metric = new ScriptedMetric(Duration.ofSeconds(10));

        assertEquals(UpdateOutcome.Kind.UNCHANGED, metric.update().getKind());
        assertEquals("{\"collects\":1}", new String(metric.toPayload(), StandardCharsets.UTF_8));

        metric.failNext = true;
        assertTrue(metric.update().isFailed());
    }

    @Test
    void testAvailabilityTemplate() {
        assertEquals("{{ iif(value_json['a/b']|default, 'online', 'offline') if value_json is defined else value }}",
                AbstractPollingMetric.availabilityTemplate("a/b"));
    }

    /**
     * 按脚本返回结果的指标，脚本为空时返回UNCHANGED
     */
    private static class ScriptedMetric extends AbstractPollingMetric {

        final ConcurrentLinkedQueue<UpdateOutcome> script = new ConcurrentLinkedQueue<>();

        final AtomicInteger collects = new AtomicInteger();

        volatile boolean failNext;

        ScriptedMetric(Duration interval) {
            super("scripted", "mqttop/metric/scripted", interval);
        }

        @Override
        protected UpdateOutcome collect() throws MetricException {
            collects.incrementAndGet();
            if (failNext) {
                failNext = false;
                throw new MetricException("collect failed");
            }
            UpdateOutcome next = script.poll();
            return next != null ? next : UpdateOutcome.unchanged();
        }

        @Override
        protected Object snapshot() {
            return Map.of("collects", collects.get());
        }
    }
}
