/**
 * 指标存活状态表
 *
 * @author zhenglin
 * @date 2025/08/15
 */
package com.mqttop.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 主题到存活状态的并发映射
 * 
 * 条目在尝试启动指标时创建，之后只通过比较并交换改变，指标事件循环退出时删除。
 */
public class StateMap {
    
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    
    private final ConcurrentHashMap<String, Boolean> states = new ConcurrentHashMap<>();
    
    /**
     * 设置主题状态，用于创建条目
     *
     * @param topic 主题
     * @param online 是否在线
     */
    public void put(String topic, boolean online) {
        states.put(topic, online);
    }
    
    /**
     * 仅当状态与目标相反时切换
     *
     * @param topic 主题
     * @param online 目标状态
     * @return 发生切换返回true；条目不存在或状态未变返回false
     */
    public boolean transition(String topic, boolean online) {
        return states.replace(topic, !online, online);
    }
    
    /**
     * 获取主题状态
     *
     * @param topic 主题
     * @return 状态，条目不存在返回null
     */
    public Boolean get(String topic) {
        return states.get(topic);
    }
    
    public boolean remove(String topic) {
        return states.remove(topic) != null;
    }
    
    public boolean contains(String topic) {
        return states.containsKey(topic);
    }
    
    public int size() {
        return states.size();
    }
    
    public Set<String> topics() {
        return snapshot().keySet();
    }
    
    /**
     * 按主题排序的状态快照
     *
     * @return 快照
     */
    public Map<String, Boolean> snapshot() {
        return new TreeMap<>(states);
    }
    
    /**
     * 序列化快照为JSON对象
     *
     * @return JSON负载
     */
    public byte[] toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(snapshot());
        } catch (JsonProcessingException e) {
            // 字符串到布尔值的映射不会序列化失败
            throw new IllegalStateException("Failed to serialize state snapshot", e);
        }
    }
}
