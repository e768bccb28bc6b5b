/**
 * 指标能力接口
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

import java.util.Optional;

/**
 * 独立更新的数据生产者
 * 
 * 每个指标由主题和类型标识，启动后通过 {@link #updated()} 推送更新结果，
 * 可选能力（重新配置、发现）通过 {@link #capability(Class)} 显式查询。
 */
public interface Metric {
    
    /**
     * 指标类型，同类型指标共享一个发现节点
     *
     * @return 类型名称
     */
    String getType();
    
    /**
     * 指标值发布主题，空字符串表示不跟踪
     *
     * @return 主题
     */
    String getTopic();
    
    /**
     * 启动指标
     *
     * @throws MetricException 启动失败
     */
    void start() throws MetricException;
    
    /**
     * 停止指标并关闭更新通道，重复调用无副作用
     */
    void stop();
    
    /**
     * 立即刷新一次指标值
     *
     * @return 刷新结果
     */
    UpdateOutcome update();
    
    /**
     * 更新结果通道
     *
     * @return 指标私有的结果通道
     */
    OutcomeChannel updated();
    
    /**
     * 序列化当前指标值
     *
     * @return JSON负载
     * @throws MetricException 序列化失败
     */
    byte[] toPayload() throws MetricException;
    
    /**
     * 查询可选能力
     *
     * @param type 能力接口
     * @param <T> 能力类型
     * @return 指标实现了该能力时返回自身
     */
    default <T> Optional<T> capability(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }
}
