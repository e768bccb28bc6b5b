/**
 * 发现文档存储
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mqttop.common.discovery.Discovery;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 把上次发布的发现文档保存在数据目录下，下次启动时用于比对和迁移
 */
@Slf4j
public class DiscoveryStore {
    
    /**
     * 文档文件名
     */
    public static final String FILE_NAME = "discovery.json";
    
    private static final ObjectMapper OBJECT_MAPPER;
    
    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.configure(SerializationFeature.INDENT_OUTPUT, true);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    private final Path file;
    
    /**
     * @param dataDir 数据目录
     */
    public DiscoveryStore(Path dataDir) {
        this.file = dataDir.resolve(FILE_NAME);
    }
    
    public Path getFile() {
        return file;
    }
    
    /**
     * 读取上次保存的文档
     *
     * @return 文档，文件不存在时返回空
     * @throws DiscoveryException 读取或解析失败
     */
    public Optional<Discovery> load() {
        if (!Files.exists(file)) {
            log.debug("发现文档不存在: file={}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(OBJECT_MAPPER.readValue(file.toFile(), Discovery.class));
        } catch (IOException e) {
            throw new DiscoveryException("读取发现文档失败: " + file, e);
        }
    }
    
    /**
     * 保存文档，覆盖已有文件
     *
     * @param discovery 文档
     * @throws DiscoveryException 写入失败
     */
    public void save(Discovery discovery) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OBJECT_MAPPER.writeValue(file.toFile(), discovery);
            log.debug("发现文档已保存: file={}, components={}", file, discovery.getComponents().size());
        } catch (IOException e) {
            throw new DiscoveryException("保存发现文档失败: " + file, e);
        }
    }
}
