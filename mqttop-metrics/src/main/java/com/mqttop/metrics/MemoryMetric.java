/**
 * 内存指标
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
import com.mqttop.common.metric.UpdateOutcome;
import com.sun.management.OperatingSystemMXBean;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 物理内存和交换区用量
 */
public class MemoryMetric extends AbstractPollingMetric implements Discoverer {
    
    public static final String TYPE = "memory";
    
    public static final String DEFAULT_TOPIC = "mqttop/metric/memory";
    
    private final OperatingSystemMXBean os;
    
    private long total;
    
    private long used;
    
    private long swapTotal;
    
    private long swapUsed;
    
    public MemoryMetric(String topic, Duration interval) {
        this(topic, interval, ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class));
    }
    
    public MemoryMetric(String topic, Duration interval, OperatingSystemMXBean os) {
        super(TYPE, topic, interval);
        this.os = os;
    }
    
    @Override
    protected UpdateOutcome collect() throws MetricException {
        long newTotal = os.getTotalMemorySize();
        if (newTotal <= 0) {
            throw new MetricException("物理内存大小不可用");
        }
        long newUsed = newTotal - os.getFreeMemorySize();
        long newSwapTotal = os.getTotalSwapSpaceSize();
        long newSwapUsed = newSwapTotal - os.getFreeSwapSpaceSize();
        
        boolean changed = newTotal != total || newUsed != used || newSwapTotal != swapTotal || newSwapUsed != swapUsed;
        total = newTotal;
        used = newUsed;
        swapTotal = newSwapTotal;
        swapUsed = newSwapUsed;
        return changed ? UpdateOutcome.changed() : UpdateOutcome.unchanged();
    }
    
    @Override
    protected Object snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("total", total);
        payload.put("used", used);
        payload.put("swapTotal", swapTotal);
        payload.put("swapUsed", swapUsed);
        return payload;
    }
    
    @Override
    public void discover(Discovery discovery) {
        String prefix = discovery.getOrigin().getName() + "_memory";
        String template = availabilityTemplate(getTopic());
        discovery.addComponent(getType(), prefix, sensor(discovery, prefix, "Memory usage", template)
                .with(ComponentOption.VALUE_TEMPLATE, "{{ 100 * value_json.used / value_json.total }}")
                .with(ComponentOption.UNIT_OF_MEASUREMENT, "%")
                .with(ComponentOption.SUGGESTED_DISPLAY_PRECISION, 1)
                .with(ComponentOption.JSON_ATTRIBUTES_TOPIC, getTopic())
                .with(ComponentOption.JSON_ATTRIBUTES_TEMPLATE,
                        "{{ dict(value_json|items|rejectattr('0', 'match', '^swap')|list + [('size_unit', 'B')]) | tojson }}"));
        discovery.addComponent(getType(), prefix + "_total", sensor(discovery, prefix + "_total", "Memory total", template)
                .with(ComponentOption.DEVICE_CLASS, "data_size")
                .with(ComponentOption.VALUE_TEMPLATE, "{{ value_json.total }}")
                .with(ComponentOption.UNIT_OF_MEASUREMENT, "B")
                .with(ComponentOption.ENABLED_BY_DEFAULT, false));
        discovery.addComponent(getType(), prefix + "_used", sensor(discovery, prefix + "_used", "Memory used", template)
                .with(ComponentOption.DEVICE_CLASS, "data_size")
                .with(ComponentOption.VALUE_TEMPLATE, "{{ value_json.used }}")
                .with(ComponentOption.UNIT_OF_MEASUREMENT, "B")
                .with(ComponentOption.ENABLED_BY_DEFAULT, false));
        if (hasSwap()) {
            String swap = discovery.getOrigin().getName() + "_swap";
            discovery.addComponent(getType(), swap, sensor(discovery, swap, "Swap usage", template)
                    .with(ComponentOption.VALUE_TEMPLATE, "{{ 100 * value_json.swapUsed / value_json.swapTotal }}")
                    .with(ComponentOption.UNIT_OF_MEASUREMENT, "%")
                    .with(ComponentOption.SUGGESTED_DISPLAY_PRECISION, 1));
        }
    }
    
    private boolean hasSwap() {
        lock.lock();
        try {
            return swapTotal > 0;
        } finally {
            lock.unlock();
        }
    }
    
    private Component sensor(Discovery discovery, String id, String name, String availability) {
        return new Component(Platform.SENSOR)
                .with(ComponentOption.NAME, name)
                .with(ComponentOption.ICON, "mdi:memory")
                .with(ComponentOption.ENTITY_CATEGORY, "diagnostic")
                .with(ComponentOption.AVAILABILITY_TOPIC, discovery.getAvailabilityTopic())
                .with(ComponentOption.AVAILABILITY_TEMPLATE, availability)
                .with(ComponentOption.STATE_TOPIC, getTopic())
                .with(ComponentOption.UNIQUE_ID, id);
    }
}
