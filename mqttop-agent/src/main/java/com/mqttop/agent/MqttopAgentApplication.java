/**
 * mqttop桥接服务应用程序
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent;

import com.mqttop.agent.config.MqttopProperties;
import com.mqttop.agent.service.BridgeLifecycleService;
import com.mqttop.core.BridgeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * mqttop桥接服务主应用程序
 * 把系统指标持续发布到MQTT代理，并通过自动发现向Home Assistant注册
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(MqttopProperties.class)
@RequiredArgsConstructor
public class MqttopAgentApplication implements CommandLineRunner {
    
    private final BridgeLifecycleService lifecycleService;
    
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MqttopAgentApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }
    
    @Override
    public void run(String... args) {
        log.info("=================================================");
        log.info("             启动 mqttop 桥接服务");
        log.info("=================================================");
        
        try {
            lifecycleService.start();
            
            log.info("=================================================");
            log.info("           mqttop 桥接服务启动成功");
            log.info("=================================================");
        } catch (BridgeException e) {
            log.error("启动mqttop桥接服务失败", e);
            System.exit(1);
        }
    }
}
