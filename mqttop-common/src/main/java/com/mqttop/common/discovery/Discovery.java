/**
 * 发现文档
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 发现文档
 * 
 * 组件以唯一键保存，并按所属指标类型分组为节点。文档只在启动线程和发布循环上修改，
 * 不是线程安全的。
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class Discovery {
    
    @JsonProperty("o")
    private Origin origin;
    
    @JsonProperty("dev")
    private Device device;
    
    @JsonProperty("cmps")
    private Map<String, Component> components = new TreeMap<>();
    
    /**
     * 指标类型到组件唯一键的映射
     */
    @JsonProperty("_nodes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, List<String>> nodes = new TreeMap<>();
    
    @JsonProperty("_method")
    private DiscoveryMethod method = DiscoveryMethod.NODES;
    
    private String availabilityTopic;
    
    private String objectId;
    
    private String nodeId = "mqttop";
    
    /**
     * 添加组件并记录到所属节点
     *
     * @param node 指标类型
     * @param uniqueId 组件唯一键
     * @param component 组件
     */
    public void addComponent(String node, String uniqueId, Component component) {
        components.put(uniqueId, component);
        List<String> ids = nodes.computeIfAbsent(node, key -> new ArrayList<>());
        if (!ids.contains(uniqueId)) {
            ids.add(uniqueId);
        }
    }
    
    public Component getComponent(String uniqueId) {
        return components.get(uniqueId);
    }
    
    /**
     * 获取节点的组件唯一键
     *
     * @param node 指标类型
     * @return 唯一键副本，节点不存在时为空列表
     */
    public List<String> getNode(String node) {
        List<String> ids = nodes.get(node);
        return ids != null ? new ArrayList<>(ids) : Collections.emptyList();
    }
    
    /**
     * 替换节点的组件唯一键，结果去重并排序
     *
     * @param node 指标类型
     * @param ids 组件唯一键
     */
    public void setNode(String node, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            nodes.remove(node);
            return;
        }
        nodes.put(node, new ArrayList<>(new TreeSet<>(ids)));
    }
    
    /**
     * 把节点下的组件替换为只保留平台的占位符
     *
     * @param node 指标类型
     * @return 被替换的唯一键
     */
    public List<String> blankNode(String node) {
        List<String> ids = getNode(node);
        for (String id : ids) {
            Component component = components.get(id);
            if (component != null) {
                components.put(id, Component.placeholder(component.getPlatform()));
            }
        }
        return ids;
    }
    
    /**
     * 删除节点下仍是占位符的组件
     *
     * @param node 指标类型
     */
    public void prunePlaceholders(String node) {
        List<String> kept = new ArrayList<>();
        for (String id : getNode(node)) {
            Component component = components.get(id);
            if (component == null || component.isPlaceholder()) {
                components.remove(id);
            } else {
                kept.add(id);
            }
        }
        setNode(node, kept);
    }
    
    /**
     * 为旧文档中存在而当前文档缺失的组件添加占位符，以便发布时删除它们
     *
     * @param old 上次保存的文档，可为null
     * @return 发布方式在device与components之间切换时返回true
     */
    public boolean diff(Discovery old) {
        if (old == null) {
            return false;
        }
        old.getComponents().forEach((id, component) -> {
            if (components.containsKey(id) || component.isPlaceholder()) {
                return;
            }
            components.put(id, Component.placeholder(component.getPlatform()));
        });
        return shouldMigrate(method, old.getMethod());
    }
    
    /**
     * 构造设备负载 {o, dev, cmps}
     *
     * @param ids 包含的组件唯一键，null表示全部
     * @return 负载映射
     */
    public Map<String, Object> toDevicePayload(Collection<String> ids) {
        Map<String, Component> selected = new TreeMap<>();
        components.forEach((id, component) -> {
            if (ids == null || ids.contains(id)) {
                selected.put(id, component);
            }
        });
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("o", origin);
        payload.put("dev", device);
        payload.put("cmps", selected);
        return payload;
    }
    
    /**
     * 计算发现主题 prefix/component/[nodeId/]objectId/config
     */
    public String topic(String prefix, String component, String node, String object) {
        String id = object == null || object.isEmpty() ? objectId : object;
        StringBuilder topic = new StringBuilder(prefix).append('/').append(component).append('/');
        if (node != null && !node.isEmpty()) {
            topic.append(node).append('/');
        }
        return topic.append(id).append("/config").toString();
    }
    
    static boolean shouldMigrate(DiscoveryMethod current, DiscoveryMethod old) {
        if (old == null || old == DiscoveryMethod.DEVICE) {
            return current == DiscoveryMethod.COMPONENTS;
        }
        if (old == DiscoveryMethod.COMPONENTS) {
            return current == DiscoveryMethod.DEVICE;
        }
        return false;
    }
}
