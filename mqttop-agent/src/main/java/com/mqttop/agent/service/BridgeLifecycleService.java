/**
 * 桥接器生命周期管理
 *
 * @author zhenglin
 * @date 2025/08/19
 */
package com.mqttop.agent.service;

import com.mqttop.core.Bridge;
import com.mqttop.core.discovery.DiscoveryException;
import com.mqttop.core.discovery.DiscoveryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 桥接器生命周期管理器
 * 负责启动桥接器、桥接器自行结束时退出应用、应用关闭时停止桥接器并保存发现文档
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeLifecycleService {
    
    private final Bridge bridge;
    
    private final ObjectProvider<DiscoveryStore> discoveryStore;
    
    private final ConfigurableApplicationContext context;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    /**
     * 启动桥接器
     *
     * @throws com.mqttop.core.BridgeException 没有指标或连接失败
     */
    public void start() {
        bridge.start();
        bridge.done().thenRun(this::onBridgeDone);
        bridge.ready().thenRun(() -> bridge.getStartupError().ifPresent(
                error -> log.warn("桥接器启动过程中出现错误: {}", error.getMessage())));
    }
    
    /**
     * 应用关闭时停止桥接器
     */
    @PreDestroy
    public void stop() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("正在停止桥接器...");
        bridge.stop();
        saveDiscovery();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * 桥接器自行结束（如收到桥接器停止请求）时退出应用
     */
    private void onBridgeDone() {
        if (shuttingDown.get()) {
            return;
        }
        log.info("桥接器已结束，退出应用");
        Thread exit = new Thread(() -> {
            saveDiscovery();
            shuttingDown.set(true);
            System.exit(SpringApplication.exit(context));
        }, "mqttop-exit");
        exit.start();
    }
    
    private void saveDiscovery() {
        DiscoveryStore store = discoveryStore.getIfAvailable();
        if (store == null) {
            return;
        }
        bridge.getDiscovery().ifPresent(publisher -> {
            try {
                store.save(publisher.getDiscovery());
                log.info("发现文档已保存: file={}", store.getFile());
            } catch (DiscoveryException e) {
                log.warn("保存发现文档失败: error={}", e.getMessage());
            }
        });
    }
}
