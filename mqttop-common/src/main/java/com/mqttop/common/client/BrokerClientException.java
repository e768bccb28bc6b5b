/**
 * 代理客户端异常
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

/**
 * 代理操作失败时由令牌携带或直接抛出的异常
 */
public class BrokerClientException extends RuntimeException {
    
    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;
    
    /**
     * 创建代理客户端异常
     *
     * @param message 异常消息
     */
    public BrokerClientException(String message) {
        super(message);
    }
    
    /**
     * 创建代理客户端异常
     *
     * @param message 异常消息
     * @param cause 原因异常
     */
    public BrokerClientException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * 创建代理客户端异常
     *
     * @param cause 原因异常
     */
    public BrokerClientException(Throwable cause) {
        super(cause);
    }
}
