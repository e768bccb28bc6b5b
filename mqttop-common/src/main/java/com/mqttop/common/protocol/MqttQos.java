/**
 * MQTT QoS级别定义
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.protocol;

/**
 * MQTT服务质量（Quality of Service）级别
 * 桥接器发布指标、状态与发现文档时使用
 */
public enum MqttQos {
    /**
     * 至多一次传递
     * 指标数值发布使用该级别，丢失的数值会被下一次更新覆盖
     */
    AT_MOST_ONCE(0),
    
    /**
     * 至少一次传递
     * 遗嘱消息默认使用该级别
     */
    AT_LEAST_ONCE(1),
    
    /**
     * 恰好一次传递
     */
    EXACTLY_ONCE(2);
    
    /**
     * QoS级别值
     */
    private final int value;
    
    MqttQos(int value) {
        this.value = value;
    }
    
    /**
     * 获取QoS级别值
     *
     * @return QoS级别值
     */
    public int getValue() {
        return value;
    }
    
    /**
     * 根据值获取QoS级别
     *
     * @param value QoS级别值
     * @return QoS级别
     * @throws IllegalArgumentException 如果QoS级别不支持
     */
    public static MqttQos fromValue(int value) {
        for (MqttQos qos : values()) {
            if (qos.value == value) {
                return qos;
            }
        }
        throw new IllegalArgumentException("Invalid QoS level: " + value);
    }
    
    /**
     * 检查是否是有效的QoS级别
     *
     * @param value QoS级别值
     * @return 如果有效返回true
     */
    public static boolean isValid(int value) {
        return value >= 0 && value <= 2;
    }
    
    @Override
    public String toString() {
        return "QoS " + value;
    }
}
