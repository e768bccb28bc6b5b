/**
 * 发现发布方式
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 发现文档的发布方式
 */
public enum DiscoveryMethod {
    /**
     * 整个文档作为一个设备负载发布
     */
    DEVICE("device"),
    /**
     * 每个组件单独发布
     */
    COMPONENTS("components"),
    /**
     * 每个指标类型作为一个设备负载发布
     */
    NODES("nodes");
    
    private final String value;
    
    DiscoveryMethod(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * 解析发布方式，空值视为device，metrics是nodes的别名
     *
     * @param value 发布方式名称
     * @return 发布方式
     */
    @JsonCreator
    public static DiscoveryMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEVICE;
        }
        String normalized = value.trim().toLowerCase();
        if ("metrics".equals(normalized)) {
            return NODES;
        }
        for (DiscoveryMethod method : values()) {
            if (method.value.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Invalid discovery method: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
