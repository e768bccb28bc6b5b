/**
 * mqttop配置测试
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MqttopProperties配置测试
 */
@SpringBootTest(classes = MqttopPropertiesTest.TestConfig.class)
@TestPropertySource(properties = {
    "mqttop.base-topic=home/pc",
    "mqttop.interval=5s",
    "mqttop.mqtt.host=broker.lan",
    "mqttop.mqtt.username=user",
    "mqttop.mqtt.will-qos=2",
    "mqttop.discovery.method=components",
    "mqttop.discovery.wait-topic=homeassistant/status",
    "mqttop.discovery.wait-timeout=1m",
    "mqttop.bridge.failure-threshold=3",
    "mqttop.metrics.cpu.selection-mode=process",
    "mqttop.metrics.disks.enabled=false",
    "mqttop.metrics.memory.interval=500ms"
})
class MqttopPropertiesTest {

    @Autowired
    private MqttopProperties properties;

    @Test
    void testDefaultConfiguration() {
        MqttopProperties config = new MqttopProperties();

        // 测试默认值
        assertEquals("mqttop", config.getBaseTopic());
        assertEquals(Duration.ofSeconds(2), config.getInterval());

        assertEquals("localhost", config.getMqtt().getHost());
        assertEquals(1883, config.getMqtt().getPort());
        assertEquals("mqttop", config.getMqtt().getClientId());
        assertEquals(Duration.ofSeconds(60), config.getMqtt().getKeepAlive());
        assertTrue(config.getMqtt().isBirthWillEnabled());
        assertEquals("mqttop/bridge/status", config.getMqtt().getBirthWillTopic());
        assertEquals("offline", config.getMqtt().getWillPayload());
        assertEquals(1, config.getMqtt().getWillQos());
        assertFalse(config.getMqtt().isDryRun());

        assertTrue(config.getDiscovery().isEnabled());
        assertEquals("homeassistant", config.getDiscovery().getPrefix());
        assertEquals("nodes", config.getDiscovery().getMethod());
        assertEquals(0, config.getDiscovery().getQos());
        assertTrue(config.getDiscovery().isRetained());
        assertNull(config.getDiscovery().getDataPath());

        assertEquals(0, config.getBridge().getFailureThreshold());
        assertEquals(64, config.getBridge().getQueueCapacity());
        assertEquals(Duration.ofSeconds(1), config.getBridge().getRefreshDelay());

        assertTrue(config.getMetrics().getCpu().isEnabled());
        assertEquals("system", config.getMetrics().getCpu().getSelectionMode());
        assertNull(config.getMetrics().getMemory().getInterval());
        assertNull(config.getMetrics().getDisks().getTopic());
    }

    @Test
    void testBoundConfiguration() {
        assertEquals("home/pc", properties.getBaseTopic());
        assertEquals(Duration.ofSeconds(5), properties.getInterval());
        assertEquals("broker.lan", properties.getMqtt().getHost());
        assertEquals("user", properties.getMqtt().getUsername());
        assertEquals(2, properties.getMqtt().getWillQos());
        assertEquals("components", properties.getDiscovery().getMethod());
        assertEquals("homeassistant/status", properties.getDiscovery().getWaitTopic());
        assertEquals(Duration.ofMinutes(1), properties.getDiscovery().getWaitTimeout());
        assertEquals(3, properties.getBridge().getFailureThreshold());
        assertEquals("process", properties.getMetrics().getCpu().getSelectionMode());
        assertFalse(properties.getMetrics().getDisks().isEnabled());
        assertEquals(Duration.ofMillis(500), properties.getMetrics().getMemory().getInterval());
    }

    @Configuration
    @EnableConfigurationProperties(MqttopProperties.class)
    static class TestConfig {
    }
}
