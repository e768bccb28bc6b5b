/**
 * 代理客户端接口
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

import com.mqttop.common.protocol.MqttQos;

import java.util.Map;

/**
 * MQTT代理客户端能力
 * 桥接器只消费该接口，具体的网络实现和重连策略由实现类负责
 */
public interface BrokerClient {
    
    /**
     * 连接到代理
     *
     * @return 连接操作令牌
     */
    Token connect();
    
    /**
     * 断开连接
     *
     * @param quiesceMillis 等待在途操作完成的时间（毫秒）
     */
    void disconnect(long quiesceMillis);
    
    /**
     * 检查是否已连接
     *
     * @return 已连接返回true
     */
    boolean isConnected();
    
    /**
     * 发布消息
     *
     * @param topic 主题
     * @param qos QoS等级
     * @param retained 保留消息标志
     * @param payload 消息负载
     * @return 发布操作令牌
     */
    Token publish(String topic, MqttQos qos, boolean retained, byte[] payload);
    
    /**
     * 订阅单个主题
     *
     * @param topicFilter 主题过滤器
     * @param qos QoS等级
     * @param handler 消息处理器
     * @return 订阅操作令牌
     */
    Token subscribe(String topicFilter, MqttQos qos, MessageHandler handler);
    
    /**
     * 使用同一个处理器订阅多个主题
     *
     * @param filters 主题过滤器与QoS的映射
     * @param handler 消息处理器
     * @return 订阅操作令牌
     */
    Token subscribeMultiple(Map<String, MqttQos> filters, MessageHandler handler);
    
    /**
     * 取消订阅
     *
     * @param topicFilters 主题过滤器
     * @return 取消订阅操作令牌
     */
    Token unsubscribe(String... topicFilters);
    
    /**
     * 获取连接时配置的遗嘱参数
     *
     * @return 只读的遗嘱参数快照
     */
    WillOptions getWillOptions();
}
