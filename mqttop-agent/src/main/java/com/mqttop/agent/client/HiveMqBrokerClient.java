/**
 * 基于HiveMQ客户端的代理客户端
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent.client;

import com.hivemq.client.mqtt.MqttClient;
import com.hivemq.client.mqtt.lifecycle.MqttDisconnectSource;
import com.hivemq.client.mqtt.mqtt3.Mqtt3AsyncClient;
import com.hivemq.client.mqtt.mqtt3.message.auth.Mqtt3SimpleAuth;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3Connect;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3ConnectBuilder;
import com.hivemq.client.mqtt.mqtt3.message.publish.Mqtt3Publish;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.Mqtt3Subscribe;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.Mqtt3Subscription;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.suback.Mqtt3SubAck;
import com.hivemq.client.mqtt.mqtt3.message.unsubscribe.Mqtt3Unsubscribe;
import com.hivemq.client.mqtt.mqtt3.message.unsubscribe.Mqtt3UnsubscribeBuilder;
import com.mqttop.agent.config.MqttopProperties;
import com.mqttop.common.client.BrokerClient;
import com.mqttop.common.client.BrokerClientException;
import com.mqttop.common.client.BrokerMessage;
import com.mqttop.common.client.MessageHandler;
import com.mqttop.common.client.Token;
import com.mqttop.common.client.WillOptions;
import com.mqttop.common.protocol.MqttQos;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 基于 HiveMQ MQTT 3.1.1 异步客户端的代理客户端
 *
 * 首次连接成功后，非用户主动的断开会自动重连。
 */
@Slf4j
public class HiveMqBrokerClient implements BrokerClient {

    private static final long RECONNECT_DELAY_SECONDS = 5;

    private final MqttopProperties.Mqtt config;

    private final WillOptions willOptions;

    private final Mqtt3AsyncClient client;

    private final AtomicBoolean connectedOnce = new AtomicBoolean(false);

    public HiveMqBrokerClient(MqttopProperties.Mqtt config, WillOptions willOptions) {
        this.config = config;
        this.willOptions = willOptions;
        this.client = MqttClient.builder()
                .useMqttVersion3()
                .identifier(config.getClientId())
                .serverHost(config.getHost())
                .serverPort(config.getPort())
                .addConnectedListener(context -> {
                    connectedOnce.set(true);
                    log.info("已连接代理: host={}, port={}", config.getHost(), config.getPort());
                })
                .addDisconnectedListener(context -> {
                    if (context.getSource() == MqttDisconnectSource.USER || !connectedOnce.get()) {
                        return;
                    }
                    log.warn("与代理断开连接，{}秒后重连: cause={}", RECONNECT_DELAY_SECONDS,
                            context.getCause().getMessage());
                    context.getReconnector().reconnect(true).delay(RECONNECT_DELAY_SECONDS, TimeUnit.SECONDS);
                })
                .buildAsync();
    }

    @Override
    public Token connect() {
        Mqtt3ConnectBuilder builder = Mqtt3Connect.builder()
                .keepAlive((int) config.getKeepAlive().getSeconds())
                .cleanSession(true);
        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            byte[] password = config.getPassword() != null
                    ? config.getPassword().getBytes(StandardCharsets.UTF_8) : new byte[0];
            builder = builder.simpleAuth(Mqtt3SimpleAuth.builder()
                    .username(config.getUsername())
                    .password(password)
                    .build());
        }
        if (willOptions.isEnabled()) {
            builder = builder.willPublish(Mqtt3Publish.builder()
                    .topic(willOptions.getTopic())
                    .qos(toHiveMq(willOptions.getQos()))
                    .payload(willOptions.getPayload())
                    .retain(willOptions.isRetained())
                    .build());
        }
        log.info("连接代理: host={}, port={}, clientId={}", config.getHost(), config.getPort(), config.getClientId());
        return Token.of(client.connect(builder.build()));
    }

    @Override
    public void disconnect(long quiesceMillis) {
        try {
            client.disconnect().get(quiesceMillis, TimeUnit.MILLISECONDS);
            log.info("已断开代理连接");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("断开连接被中断");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("断开连接失败: error={}", e.getMessage());
        }
    }

    @Override
    public boolean isConnected() {
        return client.getState().isConnected();
    }

    @Override
    public Token publish(String topic, MqttQos qos, boolean retained, byte[] payload) {
        return Token.of(client.publish(Mqtt3Publish.builder()
                .topic(topic)
                .qos(toHiveMq(qos))
                .retain(retained)
                .payload(payload)
                .build()));
    }

    @Override
    public Token subscribe(String topicFilter, MqttQos qos, MessageHandler handler) {
        return subscribeMultiple(Map.of(topicFilter, qos), handler);
    }

    @Override
    public Token subscribeMultiple(Map<String, MqttQos> filters, MessageHandler handler) {
        List<Mqtt3Subscription> subscriptions = new ArrayList<>();
        filters.forEach((filter, qos) -> subscriptions.add(Mqtt3Subscription.builder()
                .topicFilter(filter)
                .qos(toHiveMq(qos))
                .build()));
        Mqtt3Subscribe subscribe = Mqtt3Subscribe.builder()
                .addSubscriptions(subscriptions)
                .build();
        CompletableFuture<Mqtt3SubAck> future = client.subscribe(subscribe, callback(handler))
                .thenApply(subAck -> {
                    if (subAck.getReturnCodes().stream().anyMatch(code -> code.isError())) {
                        throw new BrokerClientException("代理拒绝订阅: " + filters.keySet());
                    }
                    return subAck;
                });
        return Token.of(future);
    }

    @Override
    public Token unsubscribe(String... topicFilters) {
        if (topicFilters.length == 0) {
            return Token.completed();
        }
        Mqtt3UnsubscribeBuilder.Complete builder = Mqtt3Unsubscribe.builder().addTopicFilter(topicFilters[0]);
        for (int i = 1; i < topicFilters.length; i++) {
            builder = builder.addTopicFilter(topicFilters[i]);
        }
        return Token.of(client.unsubscribe(builder.build()));
    }

    @Override
    public WillOptions getWillOptions() {
        return willOptions;
    }

    private Consumer<Mqtt3Publish> callback(MessageHandler handler) {
        return publish -> {
            BrokerMessage message = BrokerMessage.builder()
                    .topic(publish.getTopic().toString())
                    .payload(publish.getPayloadAsBytes())
                    .qos(MqttQos.fromValue(publish.getQos().getCode()))
                    .retained(publish.isRetain())
                    .build();
            try {
                handler.onMessage(this, message);
            } catch (RuntimeException e) {
                log.warn("处理消息失败: topic={}", message.getTopic(), e);
            }
        };
    }

    private static com.hivemq.client.mqtt.datatypes.MqttQos toHiveMq(MqttQos qos) {
        return com.hivemq.client.mqtt.datatypes.MqttQos.fromCode(qos.getValue());
    }
}
