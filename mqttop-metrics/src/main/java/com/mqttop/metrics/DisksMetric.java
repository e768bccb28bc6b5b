/**
 * 磁盘指标
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
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * 文件存储用量
 * 
 * 存储集合发生变化时返回 RESCANNED，由桥接器重新发现磁盘组件。
 */
@Slf4j
public class DisksMetric extends AbstractPollingMetric implements Discoverer {
    
    public static final String TYPE = "disks";
    
    public static final String DEFAULT_TOPIC = "mqttop/metric/disks";
    
    private static final Set<String> PSEUDO_TYPES = Set.of(
            "proc", "sysfs", "devtmpfs", "devpts", "cgroup", "cgroup2", "securityfs", "debugfs",
            "tracefs", "pstore", "bpf", "mqueue", "hugetlbfs", "configfs", "fusectl", "autofs",
            "binfmt_misc", "nsfs", "overlay", "squashfs");
    
    private final Supplier<Iterable<FileStore>> stores;
    
    /**
     * 存储名称到用量，按名称排序
     */
    private Map<String, Usage> disks = new TreeMap<>();
    
    public DisksMetric(String topic, Duration interval) {
        this(topic, interval, () -> FileSystems.getDefault().getFileStores());
    }
    
    public DisksMetric(String topic, Duration interval, Supplier<Iterable<FileStore>> stores) {
        super(TYPE, topic, interval);
        this.stores = stores;
    }
    
    @Override
    protected UpdateOutcome collect() throws MetricException {
        Map<String, Usage> scanned = new TreeMap<>();
        for (FileStore store : stores.get()) {
            if (PSEUDO_TYPES.contains(store.type()) || scanned.containsKey(store.name())) {
                continue;
            }
            try {
                long total = store.getTotalSpace();
                if (total <= 0) {
                    continue;
                }
                scanned.put(store.name(), new Usage(total, total - store.getUnallocatedSpace(), store.getUsableSpace()));
            } catch (IOException e) {
                log.debug("读取文件存储失败: store={}, error={}", store.name(), e.getMessage());
            }
        }
        if (scanned.isEmpty()) {
            throw new MetricException("没有可用的文件存储");
        }
        
        boolean rescanned = !scanned.keySet().equals(disks.keySet());
        boolean changed = !scanned.equals(disks);
        disks = scanned;
        if (rescanned) {
            log.debug("文件存储集合变化: disks={}", scanned.keySet());
            return UpdateOutcome.rescanned();
        }
        return changed ? UpdateOutcome.changed() : UpdateOutcome.unchanged();
    }
    
    @Override
    protected Object snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        disks.forEach((name, usage) -> {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("total", usage.total);
            value.put("used", usage.used);
            value.put("free", usage.free);
            payload.put(name, value);
        });
        return payload;
    }
    
    public Set<String> getDiskNames() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(disks.keySet()));
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void discover(Discovery discovery) {
        String template = availabilityTemplate(getTopic());
        for (String name : getDiskNames()) {
            String id = discovery.getOrigin().getName() + "_disk_" + slug(name);
            Component component = new Component(Platform.SENSOR)
                    .with(ComponentOption.NAME, "Disk " + name)
                    .with(ComponentOption.ICON, "mdi:harddisk")
                    .with(ComponentOption.ENTITY_CATEGORY, "diagnostic")
                    .with(ComponentOption.AVAILABILITY_TOPIC, discovery.getAvailabilityTopic())
                    .with(ComponentOption.AVAILABILITY_TEMPLATE, template)
                    .with(ComponentOption.STATE_TOPIC, getTopic())
                    .with(ComponentOption.VALUE_TEMPLATE,
                            "{{ 100 * value_json['" + name + "'].used / value_json['" + name + "'].total }}")
                    .with(ComponentOption.UNIT_OF_MEASUREMENT, "%")
                    .with(ComponentOption.SUGGESTED_DISPLAY_PRECISION, 1)
                    .with(ComponentOption.JSON_ATTRIBUTES_TOPIC, getTopic())
                    .with(ComponentOption.JSON_ATTRIBUTES_TEMPLATE,
                            "{{ dict(value_json['" + name + "']|items|list + [('size_unit', 'B')]) | tojson }}")
                    .with(ComponentOption.UNIQUE_ID, id);
            discovery.addComponent(getType(), id, component);
        }
    }
    
    static String slug(String name) {
        String slug = name.replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "root" : slug.toLowerCase();
    }
    
    private static final class Usage {
        private final long total;
        private final long used;
        private final long free;
        
        private Usage(long total, long used, long free) {
            this.total = total;
            this.used = used;
            this.free = free;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Usage)) {
                return false;
            }
            Usage other = (Usage) o;
            return total == other.total && used == other.used && free == other.free;
        }
        
        @Override
        public int hashCode() {
            return Long.hashCode(total) * 31 * 31 + Long.hashCode(used) * 31 + Long.hashCode(free);
        }
    }
}
