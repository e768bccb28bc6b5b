/**
 * 实体平台
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Home Assistant 实体平台
 */
public enum Platform {
    SENSOR("sensor"),
    BINARY_SENSOR("binary_sensor"),
    BUTTON("button"),
    SWITCH("switch");
    
    private final String value;
    
    Platform(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
