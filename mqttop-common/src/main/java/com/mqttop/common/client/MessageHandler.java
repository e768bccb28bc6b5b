/**
 * 订阅消息处理器
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

/**
 * 订阅消息回调
 * 回调在客户端的消息线程上执行，实现不应长时间阻塞
 */
@FunctionalInterface
public interface MessageHandler {
    
    /**
     * 处理收到的消息
     *
     * @param client 收到消息的客户端
     * @param message 消息
     */
    void onMessage(BrokerClient client, BrokerMessage message);
}
