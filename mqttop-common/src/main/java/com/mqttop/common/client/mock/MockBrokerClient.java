/**
 * 模拟代理客户端
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.client.mock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.client.BrokerClient;
import com.mqttop.common.client.BrokerClientException;
import com.mqttop.common.client.BrokerMessage;
import com.mqttop.common.client.MessageHandler;
import com.mqttop.common.client.Token;
import com.mqttop.common.client.WillOptions;
import com.mqttop.common.protocol.MqttQos;
import com.mqttop.common.util.TopicMatcher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 不访问网络的确定性代理客户端
 * 
 * 记录所有发布与订阅操作，可向已订阅的处理器投递消息，并支持注入连接、订阅和发布失败。
 * 配置了输出Writer时，每次发布都以 {"topic": payload} 的JSON行写出，用于演练模式。
 */
@Slf4j
public class MockBrokerClient implements BrokerClient {
    
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    
    private final WillOptions willOptions;
    
    private final Writer output;
    
    private final List<PublishedMessage> published = new CopyOnWriteArrayList<>();
    
    private final List<String> operations = new CopyOnWriteArrayList<>();
    
    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
    
    private volatile boolean connected;
    
    private volatile Throwable connectFailure;
    
    private volatile CompletableFuture<Void> pendingConnect;
    
    private volatile Predicate<String> subscribeFailure = topic -> false;
    
    private volatile Predicate<String> publishFailure = topic -> false;
    
    public MockBrokerClient() {
        this(WillOptions.disabled(), null);
    }
    
    public MockBrokerClient(WillOptions willOptions) {
        this(willOptions, null);
    }
    
    /**
     * 创建模拟客户端
     *
     * @param willOptions 遗嘱参数
     * @param output 发布输出，可为null
     */
    public MockBrokerClient(WillOptions willOptions, Writer output) {
        this.willOptions = willOptions != null ? willOptions : WillOptions.disabled();
        this.output = output;
    }
    
    @Override
    public Token connect() {
        operations.add("CONNECT");
        CompletableFuture<Void> pending = pendingConnect;
        if (pending != null) {
            return Token.of(pending.thenRun(() -> connected = true));
        }
        if (connectFailure != null) {
            return Token.failed(connectFailure);
        }
        connected = true;
        return Token.completed();
    }
    
    @Override
    public void disconnect(long quiesceMillis) {
        operations.add("DISCONNECT");
        connected = false;
    }
    
    @Override
    public boolean isConnected() {
        return connected;
    }
    
    @Override
    public Token publish(String topic, MqttQos qos, boolean retained, byte[] payload) {
        operations.add("PUBLISH " + topic);
        if (publishFailure.test(topic)) {
            return Token.failed(new BrokerClientException("模拟发布失败: " + topic));
        }
        byte[] data = payload != null ? payload : new byte[0];
        published.add(new PublishedMessage(topic, qos, retained, data));
        write(topic, data);
        return Token.completed();
    }
    
    @Override
    public Token subscribe(String topicFilter, MqttQos qos, MessageHandler handler) {
        operations.add("SUBSCRIBE " + topicFilter);
        if (subscribeFailure.test(topicFilter)) {
            return Token.failed(new BrokerClientException("模拟订阅失败: " + topicFilter));
        }
        handlers.put(topicFilter, handler);
        return Token.completed();
    }
    
    @Override
    public Token subscribeMultiple(Map<String, MqttQos> filters, MessageHandler handler) {
        for (String filter : filters.keySet()) {
            if (subscribeFailure.test(filter)) {
                operations.add("SUBSCRIBE " + filter);
                return Token.failed(new BrokerClientException("模拟订阅失败: " + filter));
            }
        }
        for (String filter : filters.keySet()) {
            operations.add("SUBSCRIBE " + filter);
            handlers.put(filter, handler);
        }
        return Token.completed();
    }
    
    @Override
    public Token unsubscribe(String... topicFilters) {
        for (String filter : topicFilters) {
            operations.add("UNSUBSCRIBE " + filter);
            handlers.remove(filter);
        }
        return Token.completed();
    }
    
    @Override
    public WillOptions getWillOptions() {
        return willOptions;
    }
    
    // ==================== 测试辅助 ====================
    
    /**
     * 向匹配主题的处理器投递消息
     *
     * @param topic 主题
     * @param payload 负载
     * @return 收到消息的处理器数量
     */
    public int deliver(String topic, String payload) {
        BrokerMessage message = BrokerMessage.builder()
                .topic(topic)
                .payload(payload.getBytes(StandardCharsets.UTF_8))
                .build();
        int count = 0;
        for (Map.Entry<String, MessageHandler> entry : new ArrayList<>(handlers.entrySet())) {
            if (TopicMatcher.matches(topic, entry.getKey())) {
                entry.getValue().onMessage(this, message);
                count++;
            }
        }
        return count;
    }
    
    /**
     * 让后续连接失败
     */
    public void failConnect(Throwable cause) {
        this.connectFailure = cause;
    }
    
    /**
     * 让后续连接挂起，直到返回的Future完成
     *
     * @return 控制连接完成的Future
     */
    public CompletableFuture<Void> holdConnect() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        this.pendingConnect = pending;
        return pending;
    }
    
    public void failSubscribe(Predicate<String> filter) {
        this.subscribeFailure = filter;
    }
    
    public void failPublish(Predicate<String> topic) {
        this.publishFailure = topic;
    }
    
    public List<PublishedMessage> getPublished() {
        return Collections.unmodifiableList(published);
    }
    
    /**
     * 获取发布到指定主题的消息
     */
    public List<PublishedMessage> getPublished(String topic) {
        return published.stream()
                .filter(message -> message.getTopic().equals(topic))
                .collect(Collectors.toList());
    }
    
    public List<String> getOperations() {
        return Collections.unmodifiableList(operations);
    }
    
    public boolean isSubscribed(String topicFilter) {
        return handlers.containsKey(topicFilter);
    }
    
    public void clear() {
        published.clear();
        operations.clear();
    }
    
    private void write(String topic, byte[] payload) {
        if (output == null) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        String text = new String(payload, StandardCharsets.UTF_8);
        try {
            line.put(topic, text.isEmpty() ? text : OBJECT_MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            line.put(topic, text);
        }
        try {
            synchronized (output) {
                output.write(OBJECT_MAPPER.writeValueAsString(line));
                output.write(System.lineSeparator());
                output.flush();
            }
        } catch (IOException e) {
            log.warn("写出演练消息失败: topic={}", topic, e);
        }
    }
}
