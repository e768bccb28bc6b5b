/**
 * 发现选项
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.mqttop.common.discovery.DiscoveryMethod;
import com.mqttop.common.protocol.MqttQos;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 发现协议参数
 */
@Getter
@Builder
@ToString
public class DiscoveryOptions {
    
    /**
     * 发现主题前缀
     */
    @Builder.Default
    private final String prefix = "homeassistant";
    
    /**
     * 发现主题中的节点ID
     */
    @Builder.Default
    private final String nodeId = "mqttop";
    
    /**
     * 设备名称，为空或为hostname时使用主机名
     */
    private final String deviceName;
    
    /**
     * 组件的可用性主题，为空时使用遗嘱主题
     */
    private final String availabilityTopic;
    
    @Builder.Default
    private final boolean retained = true;
    
    @Builder.Default
    private final MqttQos qos = MqttQos.AT_MOST_ONCE;
    
    @Builder.Default
    private final DiscoveryMethod method = DiscoveryMethod.NODES;
    
    /**
     * 首次发布前等待的主题，如 homeassistant/status
     */
    private final String waitTopic;
    
    /**
     * 等待主题上需要匹配的负载，为空表示任意负载
     */
    private final String waitPayload;
    
    @Builder.Default
    private final Duration waitTimeout = Duration.ofSeconds(30);
    
    /**
     * 发现发布后到刷新全部指标之间的间隔
     */
    @Builder.Default
    private final Duration refreshDelay = Duration.ofSeconds(1);
    
    public boolean hasWaitTopic() {
        return waitTopic != null && !waitTopic.isEmpty();
    }
    
    /**
     * 检查等待主题上的负载是否匹配
     *
     * @param payload 收到的负载
     * @return 未配置匹配负载或负载相同返回true
     */
    public boolean matchesWaitPayload(String payload) {
        return waitPayload == null || waitPayload.isEmpty() || waitPayload.equals(payload);
    }
}
