package com.mqttop.common.metric;

/**
 * 支持运行时切换采集模式的指标
 */
public interface SelectionModeConfigurable {
    
    /**
     * @param mode 采集模式名称，未知模式由实现忽略并记录
     */
    void setSelectionMode(String mode);
}
