/**
 * 桥接器装配
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent.config;

import com.mqttop.agent.client.HiveMqBrokerClient;
import com.mqttop.common.client.BrokerClient;
import com.mqttop.common.client.WillOptions;
import com.mqttop.common.client.mock.MockBrokerClient;
import com.mqttop.common.discovery.DiscoveryMethod;
import com.mqttop.common.metric.Metric;
import com.mqttop.common.protocol.MqttQos;
import com.mqttop.common.util.MetricsUtils;
import com.mqttop.core.Bridge;
import com.mqttop.core.BridgeOptions;
import com.mqttop.core.discovery.DeviceDetector;
import com.mqttop.core.discovery.DiscoveryException;
import com.mqttop.core.discovery.DiscoveryOptions;
import com.mqttop.core.discovery.DiscoveryPublisher;
import com.mqttop.core.discovery.DiscoveryStore;
import com.mqttop.metrics.CpuMetric;
import com.mqttop.metrics.DisksMetric;
import com.mqttop.metrics.MemoryMetric;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 桥接器及其依赖的装配
 */
@Slf4j
@Configuration
public class BridgeConfiguration {
    
    @Bean
    public WillOptions willOptions(MqttopProperties properties) {
        MqttopProperties.Mqtt mqtt = properties.getMqtt();
        if (!mqtt.isBirthWillEnabled()) {
            return WillOptions.disabled();
        }
        return WillOptions.builder()
                .topic(mqtt.getBirthWillTopic())
                .payload(mqtt.getWillPayload().getBytes(StandardCharsets.UTF_8))
                .qos(MqttQos.fromValue(mqtt.getWillQos()))
                .retained(true)
                .build();
    }
    
    @Bean
    public BrokerClient brokerClient(MqttopProperties properties, WillOptions willOptions) {
        if (properties.getMqtt().isDryRun()) {
            log.info("演练模式：发布内容写到标准输出");
            return new MockBrokerClient(willOptions, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        }
        return new HiveMqBrokerClient(properties.getMqtt(), willOptions);
    }
    
    @Bean
    @ConditionalOnProperty(prefix = "mqttop.discovery", name = "data-path")
    public DiscoveryStore discoveryStore(MqttopProperties properties) {
        return new DiscoveryStore(Paths.get(properties.getDiscovery().getDataPath()));
    }
    
    @Bean
    public Bridge bridge(MqttopProperties properties, BrokerClient brokerClient, WillOptions willOptions,
                         ObjectProvider<DiscoveryStore> discoveryStore, ObjectProvider<MeterRegistry> meterRegistry) {
        meterRegistry.ifAvailable(MetricsUtils::setMeterRegistry);
        
        List<Metric> metrics = createMetrics(properties);
        BridgeOptions options = BridgeOptions.builder()
                .baseTopic(properties.getBaseTopic())
                .failureThreshold(properties.getBridge().getFailureThreshold())
                .queueCapacity(properties.getBridge().getQueueCapacity())
                .build();
        
        if (!properties.getDiscovery().isEnabled()) {
            return new Bridge(brokerClient, metrics, options);
        }
        
        DiscoveryOptions discoveryOptions = discoveryOptions(properties);
        com.mqttop.common.discovery.Discovery document = DiscoveryPublisher.newDocument(
                discoveryOptions, new DeviceDetector().detect(), willOptions.getTopic());
        boolean migrate = false;
        DiscoveryStore store = discoveryStore.getIfAvailable();
        if (store != null) {
            try {
                Optional<com.mqttop.common.discovery.Discovery> previous = store.load();
                if (previous.isPresent()) {
                    migrate = document.diff(previous.get());
                }
            } catch (DiscoveryException e) {
                log.warn("读取上次发现文档失败，忽略: error={}", e.getMessage());
            }
        }
        log.info("启用自动发现: method={}, prefix={}, migrate={}", document.getMethod(), discoveryOptions.getPrefix(), migrate);
        return new Bridge(brokerClient, metrics, options,
                new DiscoveryPublisher(brokerClient, document, discoveryOptions), migrate);
    }
    
    static DiscoveryOptions discoveryOptions(MqttopProperties properties) {
        MqttopProperties.Discovery discovery = properties.getDiscovery();
        return DiscoveryOptions.builder()
                .prefix(discovery.getPrefix())
                .nodeId(discovery.getNodeId())
                .deviceName(discovery.getDeviceName())
                .availabilityTopic(discovery.getAvailabilityTopic())
                .retained(discovery.isRetained())
                .qos(MqttQos.fromValue(discovery.getQos()))
                .method(DiscoveryMethod.fromValue(discovery.getMethod()))
                .waitTopic(discovery.getWaitTopic())
                .waitPayload(discovery.getWaitPayload())
                .waitTimeout(discovery.getWaitTimeout())
                .refreshDelay(properties.getBridge().getRefreshDelay())
                .build();
    }
    
    static List<Metric> createMetrics(MqttopProperties properties) {
        MqttopProperties.Metrics config = properties.getMetrics();
        List<Metric> metrics = new ArrayList<>();
        if (config.getCpu().isEnabled()) {
            CpuMetric cpu = new CpuMetric(topic(config.getCpu(), CpuMetric.DEFAULT_TOPIC),
                    interval(config.getCpu(), properties.getInterval()));
            cpu.setSelectionMode(config.getCpu().getSelectionMode());
            metrics.add(cpu);
        }
        if (config.getMemory().isEnabled()) {
            metrics.add(new MemoryMetric(topic(config.getMemory(), MemoryMetric.DEFAULT_TOPIC),
                    interval(config.getMemory(), properties.getInterval())));
        }
        if (config.getDisks().isEnabled()) {
            metrics.add(new DisksMetric(topic(config.getDisks(), DisksMetric.DEFAULT_TOPIC),
                    interval(config.getDisks(), properties.getInterval())));
        }
        log.info("已配置指标: count={}", metrics.size());
        return metrics;
    }
    
    private static String topic(MqttopProperties.Metric metric, String defaultTopic) {
        return metric.getTopic() != null && !metric.getTopic().isEmpty() ? metric.getTopic() : defaultTopic;
    }
    
    private static Duration interval(MqttopProperties.Metric metric, Duration defaultInterval) {
        return metric.getInterval() != null ? metric.getInterval() : defaultInterval;
    }
}
