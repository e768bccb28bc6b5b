/**
 * CPU使用率指标
 *
 * @author zhenglin
 * @date 2025/08/18
 */
package com.mqttop.metrics;

import com.mqttop.common.discovery.Component;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Discoverer;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.Platform;
import com.mqttop.common.metric.MetricException;
import com.mqttop.common.metric.SelectionModeConfigurable;
import com.mqttop.common.metric.UpdateOutcome;
import com.sun.management.OperatingSystemMXBean;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CPU使用率指标
 * 
 * 采集模式 system 读取整机负载，process 读取本进程负载。
 */
@Slf4j
public class CpuMetric extends AbstractPollingMetric implements Discoverer, SelectionModeConfigurable {
    
    public static final String TYPE = "cpu";
    
    public static final String DEFAULT_TOPIC = "mqttop/metric/cpu";
    
    /**
     * 采集模式
     */
    public enum SelectionMode {
        SYSTEM, PROCESS;
        
        static SelectionMode parse(String mode) {
            return SelectionMode.valueOf(mode.trim().toUpperCase());
        }
    }
    
    private final OperatingSystemMXBean os;
    
    private final int processors;
    
    private volatile SelectionMode mode = SelectionMode.SYSTEM;
    
    private double usage = -1;
    
    public CpuMetric(String topic, Duration interval) {
        this(topic, interval, ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class));
    }
    
    public CpuMetric(String topic, Duration interval, OperatingSystemMXBean os) {
        super(TYPE, topic, interval);
        this.os = os;
        this.processors = os.getAvailableProcessors();
    }
    
    public SelectionMode getSelectionMode() {
        return mode;
    }
    
    @Override
    public void setSelectionMode(String selectionMode) {
        try {
            this.mode = SelectionMode.parse(selectionMode);
            log.info("CPU采集模式已切换: mode={}", mode);
        } catch (IllegalArgumentException e) {
            log.warn("未知的CPU采集模式: mode={}", selectionMode);
        }
    }
    
    @Override
    protected UpdateOutcome collect() throws MetricException {
        double load = mode == SelectionMode.PROCESS ? os.getProcessCpuLoad() : os.getCpuLoad();
        if (load < 0) {
            throw new MetricException("CPU负载不可用: mode=" + mode);
        }
        double value = Math.round(load * 1000.0) / 10.0;
        if (value == usage) {
            return UpdateOutcome.unchanged();
        }
        usage = value;
        return UpdateOutcome.changed();
    }
    
    @Override
    protected Object snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("usage", usage);
        payload.put("mode", mode.name().toLowerCase());
        payload.put("processors", processors);
        return payload;
    }
    
    @Override
    public void discover(Discovery discovery) {
        String id = discovery.getOrigin().getName() + "_cpu";
        Component component = new Component(Platform.SENSOR)
                .with(ComponentOption.NAME, "CPU usage")
                .with(ComponentOption.ICON, "mdi:cpu-64-bit")
                .with(ComponentOption.ENTITY_CATEGORY, "diagnostic")
                .with(ComponentOption.STATE_TOPIC, getTopic())
                .with(ComponentOption.AVAILABILITY_TOPIC, discovery.getAvailabilityTopic())
                .with(ComponentOption.AVAILABILITY_TEMPLATE, availabilityTemplate(getTopic()))
                .with(ComponentOption.VALUE_TEMPLATE, "{{ value_json.usage }}")
                .with(ComponentOption.UNIT_OF_MEASUREMENT, "%")
                .with(ComponentOption.JSON_ATTRIBUTES_TOPIC, getTopic())
                .with(ComponentOption.JSON_ATTRIBUTES_TEMPLATE,
                        "{{ {'mode': value_json.mode, 'processors': value_json.processors} | tojson }}")
                .with(ComponentOption.UNIQUE_ID, id);
        discovery.addComponent(getType(), id, component);
    }
}
