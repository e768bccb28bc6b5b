/**
 * 发现组件
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 发现文档中的单个实体，以缩写键保存任意配置项
 * 
 * 只含平台字段的组件是占位符，发布时表示删除该实体。
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Component {
    
    private final Map<String, Object> options = new LinkedHashMap<>();
    
    public Component() {
    }
    
    public Component(Platform platform) {
        options.put(ComponentOption.PLATFORM.getKey(), platform.getValue());
    }
    
    /**
     * 创建只保留平台的占位符
     *
     * @param platform 平台名称
     * @return 占位符组件
     */
    public static Component placeholder(String platform) {
        Component component = new Component();
        component.options.put(ComponentOption.PLATFORM.getKey(), platform);
        return component;
    }
    
    public Component with(ComponentOption option, Object value) {
        options.put(option.getKey(), value);
        return this;
    }
    
    public Object get(ComponentOption option) {
        return options.get(option.getKey());
    }
    
    public Object remove(ComponentOption option) {
        return options.remove(option.getKey());
    }
    
    public String getPlatform() {
        Object platform = options.get(ComponentOption.PLATFORM.getKey());
        return platform != null ? platform.toString() : null;
    }
    
    public boolean isPlaceholder() {
        return options.size() <= 1;
    }
    
    /**
     * 复制组件配置，用于构造单组件负载
     *
     * @return 新的可变映射
     */
    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(options);
    }
    
    @JsonAnyGetter
    Map<String, Object> getOptions() {
        return options;
    }
    
    @JsonAnySetter
    void setOption(String key, Object value) {
        options.put(key, value);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Component)) {
            return false;
        }
        return options.equals(((Component) o).options);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(options);
    }
    
    @Override
    public String toString() {
        return "Component" + options;
    }
}
