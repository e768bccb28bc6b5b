/**
 * 发现异常
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

/**
 * 发现文档的构建、发布或持久化失败
 */
public class DiscoveryException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public DiscoveryException(String message) {
        super(message);
    }
    
    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public DiscoveryException(Throwable cause) {
        super(cause);
    }
}
