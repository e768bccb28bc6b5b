/**
 * 代理消息
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

import com.mqttop.common.protocol.MqttQos;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * 从代理收到的消息
 */
@Value
@Builder
public class BrokerMessage {
    
    /**
     * 主题
     */
    String topic;
    
    /**
     * 消息负载
     */
    @Builder.Default
    byte[] payload = new byte[0];
    
    /**
     * QoS等级
     */
    @Builder.Default
    MqttQos qos = MqttQos.AT_MOST_ONCE;
    
    /**
     * 保留消息标志
     */
    boolean retained;
    
    /**
     * 以UTF-8解码负载
     *
     * @return 负载文本
     */
    public String getPayloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
