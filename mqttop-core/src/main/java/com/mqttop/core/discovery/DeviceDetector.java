/**
 * 设备信息探测
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.mqttop.common.discovery.Device;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * 从本机读取设备标识、名称、系统版本和DMI信息
 */
@Slf4j
public class DeviceDetector {
    
    private static final List<String> GENERIC_HOSTNAMES = List.of("localhost", "debian");
    
    private static final List<String> MACHINE_ID_FILES = List.of("etc/machine-id", "var/lib/dbus/machine-id");
    
    private static final String DMI_DIR = "sys/class/dmi/id";
    
    private final Path root;
    
    public DeviceDetector() {
        this(Paths.get("/"));
    }
    
    /**
     * @param root 文件系统根目录
     */
    public DeviceDetector(Path root) {
        this.root = root;
    }
    
    /**
     * 探测设备信息
     *
     * @return 设备
     * @throws DiscoveryException 无法确定设备标识
     */
    public Device detect() {
        Device device = new Device();
        device.getIdentifiers().add(identifier());
        
        hostname().filter(name -> !GENERIC_HOSTNAMES.contains(name))
                .ifPresent(name -> device.setName(titleCase(name)));
        device.setSwVersion(osRelease());
        
        Path dmi = root.resolve(DMI_DIR);
        if (Files.isDirectory(dmi)) {
            firstReadable(dmi, "product_name", "chassis_name", "board_name").ifPresent(device::setModel);
            firstReadable(dmi, "sys_vendor", "chassis_vendor", "board_vendor").ifPresent(device::setManufacturer);
        }
        return device;
    }
    
    /**
     * 机器ID的SHA-256摘要，以无填充的URL安全Base64编码
     */
    String identifier() {
        String machineId = MACHINE_ID_FILES.stream()
                .map(root::resolve)
                .map(DeviceDetector::read)
                .flatMap(Optional::stream)
                .findFirst()
                .or(this::hostname)
                .orElseThrow(() -> new DiscoveryException("无法读取机器ID"));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(machineId.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new DiscoveryException("SHA-256 不可用", e);
        }
    }
    
    Optional<String> hostname() {
        Optional<String> name = read(root.resolve("etc/hostname"));
        if (name.isPresent()) {
            return name;
        }
        try {
            return Optional.of(InetAddress.getLocalHost().getHostName());
        } catch (UnknownHostException e) {
            log.debug("无法解析主机名: {}", e.getMessage());
            return Optional.empty();
        }
    }
    
    String osRelease() {
        Path release = root.resolve("etc/os-release");
        if (Files.isReadable(release)) {
            try {
                for (String line : Files.readAllLines(release, StandardCharsets.UTF_8)) {
                    if (line.startsWith("PRETTY_NAME=")) {
                        return line.substring("PRETTY_NAME=".length()).replace("\"", "").trim();
                    }
                }
            } catch (IOException e) {
                log.debug("读取系统版本失败: {}", e.getMessage());
            }
        }
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }
    
    static String titleCase(String name) {
        StringBuilder result = new StringBuilder(name.length());
        boolean upper = true;
        for (char c : name.toCharArray()) {
            result.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = !Character.isLetterOrDigit(c);
        }
        return result.toString();
    }
    
    private static Optional<String> firstReadable(Path dir, String... names) {
        for (String name : names) {
            Optional<String> value = read(dir.resolve(name));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
    
    private static Optional<String> read(Path file) {
        if (!Files.isReadable(file)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(file, StandardCharsets.UTF_8).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException e) {
            log.debug("读取文件失败: file={}, error={}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
