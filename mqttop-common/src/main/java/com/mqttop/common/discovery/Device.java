/**
 * 发现设备
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 设备信息，把所有组件绑定到同一个设备注册项
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Device {
    
    @JsonProperty("cu")
    private String configurationUrl;
    
    /**
     * 连接元组 [类型, 标识]
     */
    @JsonProperty("cns")
    private List<List<String>> connections = new ArrayList<>();
    
    @JsonProperty("hw")
    private String hwVersion;
    
    @JsonProperty("ids")
    private List<String> identifiers = new ArrayList<>();
    
    @JsonProperty("mf")
    private String manufacturer;
    
    @JsonProperty("mdl")
    private String model;
    
    @JsonProperty("mdl_id")
    private String modelId;
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("sn")
    private String serialNumber;
    
    @JsonProperty("sa")
    private String suggestedArea;
    
    @JsonProperty("sw")
    private String swVersion;
}
