/**
 * 发现文档存储测试
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.mqttop.common.discovery.Component;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.DiscoveryMethod;
import com.mqttop.common.discovery.Origin;
import com.mqttop.common.discovery.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void testLoadMissingFile() {
        DiscoveryStore store = new DiscoveryStore(dataDir);

        assertTrue(store.load().isEmpty());
        assertEquals(dataDir.resolve("discovery.json"), store.getFile());
    }

    @Test
    void testSaveAndLoad() {
        DiscoveryStore store = new DiscoveryStore(dataDir.resolve("nested"));
        Discovery discovery = new Discovery();
        discovery.setOrigin(Origin.defaultOrigin());
        discovery.setMethod(DiscoveryMethod.COMPONENTS);
        discovery.addComponent("cpu", "mqttop_cpu", new Component(Platform.SENSOR)
                .with(ComponentOption.NAME, "CPU")
                .with(ComponentOption.UNIT_OF_MEASUREMENT, "%"));

        store.save(discovery);
        Optional<Discovery> loaded = store.load();

        assertTrue(Files.exists(dataDir.resolve("nested").resolve(DiscoveryStore.FILE_NAME)));
        assertTrue(loaded.isPresent());
        assertEquals(DiscoveryMethod.COMPONENTS, loaded.get().getMethod());
        assertEquals(List.of("mqttop_cpu"), loaded.get().getNode("cpu"));
        assertEquals("%", loaded.get().getComponent("mqttop_cpu").get(ComponentOption.UNIT_OF_MEASUREMENT));
    }

    @Test
    void testLoadCorruptFile() throws Exception {
        Files.write(dataDir.resolve(DiscoveryStore.FILE_NAME), "{not json".getBytes(StandardCharsets.UTF_8));
        DiscoveryStore store = new DiscoveryStore(dataDir);

        assertThrows(DiscoveryException.class, store::load);
    }
}
