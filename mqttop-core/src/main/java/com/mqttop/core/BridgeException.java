/**
 * 桥接器异常
 *
 * @author zhenglin
 * @date 2025/08/15
 */
package com.mqttop.core;

/**
 * 桥接器配置错误或首次连接失败
 */
public class BridgeException extends RuntimeException {
    
    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;
    
    /**
     * 创建桥接器异常
     *
     * @param message 异常消息
     */
    public BridgeException(String message) {
        super(message);
    }
    
    /**
     * 创建桥接器异常
     *
     * @param message 异常消息
     * @param cause 原因异常
     */
    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * 创建桥接器异常
     *
     * @param cause 原因异常
     */
    public BridgeException(Throwable cause) {
        super(cause);
    }
}
