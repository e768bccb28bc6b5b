/**
 * 遗嘱参数
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
 * 客户端连接时配置的遗嘱消息参数
 * 桥接器把遗嘱主题同时用作存活状态主题
 */
@Value
@Builder
public class WillOptions {
    
    /**
     * 遗嘱主题，为空表示未启用
     */
    String topic;
    
    /**
     * 遗嘱负载
     */
    @Builder.Default
    byte[] payload = "offline".getBytes(StandardCharsets.UTF_8);
    
    /**
     * QoS等级
     */
    @Builder.Default
    MqttQos qos = MqttQos.AT_LEAST_ONCE;
    
    /**
     * 保留消息标志
     */
    @Builder.Default
    boolean retained = true;
    
    /**
     * 检查遗嘱是否启用
     *
     * @return 配置了遗嘱主题返回true
     */
    public boolean isEnabled() {
        return topic != null && !topic.isEmpty();
    }
    
    /**
     * 未启用遗嘱的参数
     *
     * @return 空遗嘱参数
     */
    public static WillOptions disabled() {
        return WillOptions.builder().build();
    }
}
