/**
 * 监控指标工具类
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 桥接器自身运行指标的管理工具类
 */
public class MetricsUtils {
    
    /**
     * 默认度量注册表
     */
    private static volatile MeterRegistry meterRegistry = new SimpleMeterRegistry();
    
    // 当前加载的指标数量
    private static final AtomicLong LOADED_METRICS = new AtomicLong(0);
    
    static {
        registerGauges(meterRegistry);
    }
    
    private MetricsUtils() {
    }
    
    /**
     * 设置度量注册表
     *
     * @param registry 度量注册表
     */
    public static void setMeterRegistry(MeterRegistry registry) {
        if (registry != null) {
            meterRegistry = registry;
            registerGauges(registry);
        }
    }
    
    /**
     * 获取度量注册表
     *
     * @return 度量注册表
     */
    public static MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    private static void registerGauges(MeterRegistry registry) {
        Gauge.builder("mqttop.metrics.loaded", LOADED_METRICS, AtomicLong::get)
                .description("Number of metrics with a running event loop")
                .register(registry);
    }
    
    // ==================== 发布相关指标 ====================
    
    /**
     * 记录成功发出的指标更新
     */
    public static void recordPublishedUpdate() {
        counter("mqttop.updates.published", "Number of metric updates handed to the broker client").increment();
    }
    
    /**
     * 记录失败的指标更新
     */
    public static void recordFailedUpdate() {
        counter("mqttop.updates.failed", "Number of metric updates that could not be published").increment();
    }
    
    /**
     * 记录状态表发布
     */
    public static void recordStatesPublished() {
        counter("mqttop.states.published", "Number of state snapshots published to the will topic").increment();
    }
    
    /**
     * 记录重新发现
     */
    public static void recordRediscovery() {
        counter("mqttop.rediscoveries", "Number of incremental discovery publishes").increment();
    }
    
    // ==================== 指标生命周期 ====================
    
    /**
     * 增加已加载指标数
     *
     * @return 当前已加载指标数
     */
    public static long incrementLoadedMetrics() {
        return LOADED_METRICS.incrementAndGet();
    }
    
    /**
     * 减少已加载指标数
     *
     * @return 当前已加载指标数
     */
    public static long decrementLoadedMetrics() {
        return LOADED_METRICS.decrementAndGet();
    }
    
    /**
     * 获取已加载指标数
     *
     * @return 已加载指标数
     */
    public static long getLoadedMetrics() {
        return LOADED_METRICS.get();
    }
    
    private static Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(meterRegistry);
    }
}
