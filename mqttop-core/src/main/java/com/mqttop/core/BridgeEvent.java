package com.mqttop.core;

import com.mqttop.common.metric.Metric;
import lombok.Value;

/**
 * 中央事件队列中的事件
 */
@Value
class BridgeEvent {
    
    enum Type {
        /**
         * 发布指标值
         */
        UPDATE,
        /**
         * 重新发现指标类型
         */
        REDISCOVER
    }
    
    Type type;
    
    Metric metric;
}
