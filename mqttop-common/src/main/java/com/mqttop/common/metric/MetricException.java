/**
 * 指标异常
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

/**
 * 指标启动、采集或序列化失败
 */
public class MetricException extends Exception {
    
    private static final long serialVersionUID = 1L;
    
    public MetricException(String message) {
        super(message);
    }
    
    public MetricException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public MetricException(Throwable cause) {
        super(cause);
    }
}
