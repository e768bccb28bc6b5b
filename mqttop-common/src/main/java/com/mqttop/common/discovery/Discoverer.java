package com.mqttop.common.discovery;

/**
 * 可被发现的指标
 * 实现应通过 {@link Discovery#addComponent(String, String, Component)} 以唯一键添加自己的组件
 */
public interface Discoverer {
    
    void discover(Discovery discovery);
}
