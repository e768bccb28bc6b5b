/**
 * mqttop配置
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent.config;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * mqttop配置类
 * 包含代理连接、自动发现、桥接器和各指标的配置参数
 */
@Data
@ConfigurationProperties(prefix = "mqttop")
public class MqttopProperties {
    
    /**
     * 控制主题的基础主题
     */
    private String baseTopic = "mqttop";
    
    /**
     * 指标默认刷新间隔
     */
    private Duration interval = Duration.ofSeconds(2);
    
    /**
     * 代理连接配置
     */
    private Mqtt mqtt = new Mqtt();
    
    /**
     * 自动发现配置
     */
    private Discovery discovery = new Discovery();
    
    /**
     * 桥接器配置
     */
    private Bridge bridge = new Bridge();
    
    /**
     * 指标配置
     */
    private Metrics metrics = new Metrics();
    
    /**
     * 代理连接配置类
     */
    @Data
    public static class Mqtt {
        /**
         * 代理地址
         */
        private String host = "localhost";
        
        /**
         * 代理端口
         */
        private int port = 1883;
        
        /**
         * 客户端ID
         */
        private String clientId = "mqttop";
        
        private String username;
        
        private String password;
        
        /**
         * 保活时间
         */
        private Duration keepAlive = Duration.ofSeconds(60);
        
        /**
         * 是否启用出生/遗嘱消息
         */
        private boolean birthWillEnabled = true;
        
        /**
         * 出生/遗嘱主题，同时是状态表主题
         */
        private String birthWillTopic = "mqttop/bridge/status";
        
        /**
         * 遗嘱负载
         */
        private String willPayload = "offline";
        
        /**
         * 遗嘱QoS
         */
        private int willQos = 1;
        
        /**
         * 演练模式：不连接代理，把发布内容写到标准输出
         */
        private boolean dryRun = false;
    }
    
    /**
     * 自动发现配置类
     */
    @Data
    public static class Discovery {
        private boolean enabled = true;
        
        /**
         * 发现主题前缀
         */
        private String prefix = "homeassistant";
        
        /**
         * 设备名称，默认使用主机名
         */
        private String deviceName;
        
        private String nodeId = "mqttop";
        
        /**
         * 组件可用性主题，默认使用遗嘱主题
         */
        private String availabilityTopic;
        
        private boolean retained = true;
        
        private int qos = 0;
        
        /**
         * 发布方式：device、components、nodes（metrics）
         */
        private String method = "nodes";
        
        /**
         * 首次发布前等待的主题
         */
        private String waitTopic;
        
        private String waitPayload;
        
        private Duration waitTimeout = Duration.ofSeconds(30);
        
        /**
         * 保存上次发现文档的数据目录，为空时不保存
         */
        private String dataPath;
    }
    
    /**
     * 桥接器配置类
     */
    @Data
    public static class Bridge {
        /**
         * 连续失败多少次后标记为离线，0表示只记录日志
         */
        private int failureThreshold = 0;
        
        private int queueCapacity = 64;
        
        /**
         * 发现发布后刷新全部指标的延迟
         */
        private Duration refreshDelay = Duration.ofSeconds(1);
    }
    
    /**
     * 指标配置类
     */
    @Data
    public static class Metrics {
        private Cpu cpu = new Cpu();
        
        private Metric memory = new Metric();
        
        private Metric disks = new Metric();
    }
    
    /**
     * 单个指标配置
     */
    @Data
    public static class Metric {
        private boolean enabled = true;
        
        /**
         * 刷新间隔，为空时使用默认间隔
         */
        private Duration interval;
        
        /**
         * 发布主题，为空时使用指标默认主题
         */
        private String topic;
    }
    
    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class Cpu extends Metric {
        /**
         * 采集模式：system 或 process
         */
        private String selectionMode = "system";
    }
}
