/**
 * 发现发布器
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.client.BrokerClient;
import com.mqttop.common.client.Token;
import com.mqttop.common.discovery.Component;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Device;
import com.mqttop.common.discovery.Discoverer;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.Origin;
import com.mqttop.common.protocol.MqttQos;
import com.mqttop.common.util.MetricsUtils;
import com.mqttop.common.util.TokenUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 发现文档发布器
 * 
 * 负责按发布方式把文档发布到代理，处理等待门、迁移和按指标类型的增量重新发现。
 * 所有代理往返都与取消信号竞争，取消时静默返回。
 */
@Slf4j
public class DiscoveryPublisher {
    
    /**
     * 迁移负载
     */
    public static final byte[] MIGRATE_PAYLOAD = "{\"migrate_discovery\": true}".getBytes(StandardCharsets.UTF_8);
    
    private static final byte[] EMPTY_PAYLOAD = new byte[0];
    
    private static final String DEVICE_COMPONENT = "device";
    
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    
    private final BrokerClient client;
    
    private final Discovery discovery;
    
    private final DiscoveryOptions options;
    
    private final AtomicBoolean waited = new AtomicBoolean(false);
    
    public DiscoveryPublisher(BrokerClient client, Discovery discovery, DiscoveryOptions options) {
        this.client = client;
        this.discovery = discovery;
        this.options = options;
    }
    
    /**
     * 根据选项和设备信息创建空的发现文档
     *
     * @param options 发现选项
     * @param device 设备信息
     * @param availabilityTopic 默认可用性主题
     * @return 发现文档
     * @throws DiscoveryException 设备既没有标识也没有连接
     */
    public static Discovery newDocument(DiscoveryOptions options, Device device, String availabilityTopic) {
        String deviceName = options.getDeviceName();
        if (deviceName != null && !deviceName.isEmpty() && !"hostname".equals(deviceName)) {
            device.setName(deviceName);
        }
        if (device.getName() == null || device.getName().isEmpty()) {
            device.setName("Mqttop");
        }
        
        String objectId;
        if (!device.getIdentifiers().isEmpty()) {
            objectId = String.join("_", device.getIdentifiers());
        } else if (!device.getConnections().isEmpty()) {
            objectId = device.getConnections().stream()
                    .map(connection -> connection.get(1))
                    .collect(Collectors.joining("_"));
        } else {
            throw new DiscoveryException("No object id");
        }
        
        Discovery discovery = new Discovery();
        discovery.setOrigin(Origin.defaultOrigin());
        discovery.setDevice(device);
        discovery.setObjectId(objectId);
        discovery.setNodeId(options.getNodeId() != null && !options.getNodeId().isEmpty()
                ? options.getNodeId() : "mqttop");
        discovery.setMethod(options.getMethod());
        discovery.setAvailabilityTopic(options.getAvailabilityTopic() != null && !options.getAvailabilityTopic().isEmpty()
                ? options.getAvailabilityTopic() : availabilityTopic);
        return discovery;
    }
    
    public Discovery getDiscovery() {
        return discovery;
    }
    
    public DiscoveryOptions getOptions() {
        return options;
    }
    
    /**
     * 发布整个文档
     *
     * @param migrate 是否在device与components之间迁移
     * @param cancelled 取消信号
     * @throws DiscoveryException 发布失败
     */
    public void publish(boolean migrate, CompletableFuture<?> cancelled) {
        publish(migrate, cancelled, null);
    }
    
    /**
     * 发布文档的子集
     *
     * @param migrate 是否迁移
     * @param cancelled 取消信号
     * @param nodes 需要发布的指标类型，null表示全部
     * @throws DiscoveryException 发布失败
     */
    public void publish(boolean migrate, CompletableFuture<?> cancelled, Collection<String> nodes) {
        awaitWaitTopic(cancelled);
        if (TokenUtils.isCancelled(cancelled)) {
            return;
        }
        log.debug("发布发现文档: method={}, nodes={}", discovery.getMethod(), nodes);
        switch (discovery.getMethod()) {
            case DEVICE:
                publishDevice(migrate, cancelled);
                break;
            case COMPONENTS:
                publishComponents(migrate, cancelled, nodes);
                break;
            case NODES:
            default:
                publishNodes(cancelled, nodes);
                break;
        }
    }
    
    /**
     * 增量重新发现一个指标类型
     * 
     * 先把节点下的组件置为占位符，再让指标重新描述自己，只发布该类型的子集，
     * 最后删除没有被重新填充的占位符。
     *
     * @param type 指标类型
     * @param discoverer 指标
     * @param cancelled 取消信号
     * @throws DiscoveryException 发布失败
     */
    public void rediscover(String type, Discoverer discoverer, CompletableFuture<?> cancelled) {
        List<String> previous = discovery.blankNode(type);
        discoverer.discover(discovery);
        
        Set<String> ids = new TreeSet<>(previous);
        ids.addAll(discovery.getNode(type));
        discovery.setNode(type, ids);
        
        try {
            publish(false, cancelled, List.of(type));
            MetricsUtils.recordRediscovery();
        } finally {
            discovery.prunePlaceholders(type);
        }
    }
    
    /**
     * 订阅刷新触发
     * 
     * 配置了等待主题时，每次收到匹配消息都在延迟后执行刷新；否则只在延迟后刷新一次。
     *
     * @param refresh 刷新动作
     * @param scheduler 执行刷新的调度器
     * @return 订阅令牌
     */
    public Token subscribeRefresh(Runnable refresh, ScheduledExecutorService scheduler) {
        long delay = options.getRefreshDelay().toMillis();
        if (!options.hasWaitTopic()) {
            scheduler.schedule(refresh, delay, TimeUnit.MILLISECONDS);
            return Token.completed();
        }
        return client.subscribe(options.getWaitTopic(), MqttQos.AT_MOST_ONCE, (c, message) -> {
            if (options.matchesWaitPayload(message.getPayloadAsString())) {
                log.debug("收到刷新触发: topic={}", message.getTopic());
                scheduler.schedule(refresh, delay, TimeUnit.MILLISECONDS);
            }
        });
    }
    
    /**
     * 首次发布前等待等待主题上的消息
     */
    void awaitWaitTopic(CompletableFuture<?> cancelled) {
        if (!options.hasWaitTopic() || !waited.compareAndSet(false, true)) {
            return;
        }
        String waitTopic = options.getWaitTopic();
        CompletableFuture<Void> arrived = new CompletableFuture<>();
        Token token = client.subscribe(waitTopic, MqttQos.AT_MOST_ONCE, (c, message) -> {
            if (options.matchesWaitPayload(message.getPayloadAsString())) {
                arrived.complete(null);
            }
        });
        check(TokenUtils.awaitOrCancelled(token, cancelled), "订阅等待主题失败: " + waitTopic);
        
        log.info("等待发现主题消息: topic={}, timeout={}", waitTopic, options.getWaitTimeout());
        try {
            CompletableFuture.anyOf(arrived, cancelled)
                    .get(options.getWaitTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("等待发现主题超时，继续发布: topic={}, timeout={}", waitTopic, options.getWaitTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoveryException("等待发现主题被中断", e);
        } catch (ExecutionException e) {
            throw new DiscoveryException("等待发现主题失败", e.getCause());
        }
        if (TokenUtils.isCancelled(cancelled)) {
            return;
        }
        check(TokenUtils.awaitOrCancelled(client.unsubscribe(waitTopic), cancelled),
                "取消订阅等待主题失败: " + waitTopic);
    }
    
    private void publishDevice(boolean migrate, CompletableFuture<?> cancelled) {
        if (migrate) {
            for (Map.Entry<String, Component> entry : discovery.getComponents().entrySet()) {
                send(componentTopic(entry.getKey(), entry.getValue()), MIGRATE_PAYLOAD, cancelled);
            }
        }
        send(deviceTopic(discovery.getNodeId()), serialize(discovery.toDevicePayload(null)), cancelled);
        if (migrate) {
            for (Map.Entry<String, Component> entry : discovery.getComponents().entrySet()) {
                send(componentTopic(entry.getKey(), entry.getValue()), EMPTY_PAYLOAD, cancelled);
            }
        }
    }
    
    private void publishComponents(boolean migrate, CompletableFuture<?> cancelled, Collection<String> nodes) {
        if (migrate) {
            send(deviceTopic(discovery.getNodeId()), MIGRATE_PAYLOAD, cancelled);
        }
        Set<String> selected = null;
        if (nodes != null) {
            selected = new LinkedHashSet<>();
            for (String node : nodes) {
                selected.addAll(discovery.getNode(node));
            }
        }
        for (Map.Entry<String, Component> entry : new ArrayList<>(discovery.getComponents().entrySet())) {
            if (selected != null && !selected.contains(entry.getKey())) {
                continue;
            }
            Component component = entry.getValue();
            byte[] payload;
            if (component.isPlaceholder()) {
                payload = EMPTY_PAYLOAD;
            } else {
                Map<String, Object> fields = component.toMap();
                fields.remove(ComponentOption.PLATFORM.getKey());
                fields.put("o", discovery.getOrigin());
                fields.put("dev", discovery.getDevice());
                payload = serialize(fields);
            }
            send(componentTopic(entry.getKey(), component), payload, cancelled);
        }
        if (migrate) {
            send(deviceTopic(discovery.getNodeId()), EMPTY_PAYLOAD, cancelled);
        }
    }
    
    private void publishNodes(CompletableFuture<?> cancelled, Collection<String> nodes) {
        Collection<String> selected = nodes != null ? nodes : new ArrayList<>(discovery.getNodes().keySet());
        for (String node : selected) {
            List<String> ids = discovery.getNode(node);
            ids.removeIf(id -> discovery.getComponent(id) == null);
            if (ids.isEmpty()) {
                continue;
            }
            send(deviceTopic(discovery.getNodeId() + "_" + node), serialize(discovery.toDevicePayload(ids)), cancelled);
        }
    }
    
    private String deviceTopic(String nodeId) {
        return discovery.topic(options.getPrefix(), DEVICE_COMPONENT, nodeId, discovery.getObjectId());
    }
    
    private String componentTopic(String uniqueId, Component component) {
        return discovery.topic(options.getPrefix(), component.getPlatform(), discovery.getNodeId(), uniqueId);
    }
    
    private void send(String topic, byte[] payload, CompletableFuture<?> cancelled) {
        if (TokenUtils.isCancelled(cancelled)) {
            return;
        }
        Token token = client.publish(topic, options.getQos(), options.isRetained(), payload);
        check(TokenUtils.awaitOrCancelled(token, cancelled), "发布发现负载失败: " + topic);
    }
    
    private static void check(Throwable error, String message) {
        if (error != null) {
            throw new DiscoveryException(message, error);
        }
    }
    
    private static byte[] serialize(Object payload) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new DiscoveryException("序列化发现负载失败", e);
        }
    }
}
