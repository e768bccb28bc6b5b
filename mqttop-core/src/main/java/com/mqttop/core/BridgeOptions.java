/**
 * 桥接器选项
 *
 * @author zhenglin
 * @date 2025/08/15
 */
package com.mqttop.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 桥接器运行参数
 */
@Getter
@Builder
@ToString
public class BridgeOptions {
    
    /**
     * 默认基础主题
     */
    public static final String DEFAULT_BASE_TOPIC = "mqttop";
    
    /**
     * 控制主题的基础主题
     */
    @Builder.Default
    private final String baseTopic = DEFAULT_BASE_TOPIC;
    
    /**
     * 连续失败多少次后把指标标记为离线，0表示只记录日志
     */
    @Builder.Default
    private final int failureThreshold = 0;
    
    /**
     * 中央事件队列容量
     */
    @Builder.Default
    private final int queueCapacity = 64;
    
    /**
     * 断开连接时等待在途操作的时间（毫秒）
     */
    @Builder.Default
    private final long disconnectQuiesceMillis = 500;
    
    /**
     * 关闭时等待指标事件循环退出的时间
     */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(10);
    
    public static BridgeOptions defaults() {
        return BridgeOptions.builder().build();
    }
}
