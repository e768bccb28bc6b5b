/**
 * 发现来源
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.mqttop.common.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 发现负载的来源信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Origin {
    
    public static final String DEFAULT_NAME = "mqttop";
    
    public static final String SUPPORT_URL = "https://github.com/lone-faerie/mqttop";
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("sw")
    private String swVersion;
    
    @JsonProperty("url")
    private String supportUrl;
    
    /**
     * 默认来源，软件版本取自包清单
     *
     * @return 来源信息
     */
    public static Origin defaultOrigin() {
        String version = Origin.class.getPackage().getImplementationVersion();
        return new Origin(DEFAULT_NAME, version != null ? version : "dev", SUPPORT_URL);
    }
}
