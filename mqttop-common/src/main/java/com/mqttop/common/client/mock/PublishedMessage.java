/**
 * 模拟客户端记录的发布消息
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.client.mock;

import com.mqttop.common.protocol.MqttQos;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * 一次发布调用的记录
 */
@Value
public class PublishedMessage {
    
    String topic;
    
    MqttQos qos;
    
    boolean retained;
    
    byte[] payload;
    
    public String getPayloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
