/**
 * 发现发布器测试
 *
 * @author zhenglin
 * @date 2025/08/16
 */
package com.mqttop.core.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.client.mock.MockBrokerClient;
import com.mqttop.common.client.mock.PublishedMessage;
import com.mqttop.common.discovery.Component;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Device;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.DiscoveryMethod;
import com.mqttop.common.discovery.Platform;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 发现发布器单元测试
 */
class DiscoveryPublisherTest {

    private static final String DEVICE_TOPIC = "homeassistant/device/mqttop/host1/config";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockBrokerClient client;

    private CompletableFuture<Void> cancelled;

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        client = new MockBrokerClient();
        cancelled = new CompletableFuture<>();
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        cancelled.complete(null);
        scheduler.shutdownNow();
    }

    // ==================== 文档创建 ====================

    @Test
    void testNewDocumentUsesIdentifiers() {
        Device device = device("Host", "a", "b");

        Discovery document = DiscoveryPublisher.newDocument(options(DiscoveryMethod.DEVICE), device, "mqttop/bridge/status");

        assertEquals("a_b", document.getObjectId());
        assertEquals("mqttop", document.getNodeId());
        assertEquals("Host", document.getDevice().getName());
        assertEquals(DiscoveryMethod.DEVICE, document.getMethod());
        assertEquals("mqttop/bridge/status", document.getAvailabilityTopic());
        assertEquals("mqttop", document.getOrigin().getName());
    }

    @Test
    void testNewDocumentOverrides() {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .deviceName("Living Room PC")
                .nodeId("desk")
                .availabilityTopic("custom/status")
                .build();

        Discovery document = DiscoveryPublisher.newDocument(options, device("Host", "a"), "mqttop/bridge/status");

        assertEquals("Living Room PC", document.getDevice().getName());
        assertEquals("desk", document.getNodeId());
        assertEquals("custom/status", document.getAvailabilityTopic());
    }

    @Test
    void testNewDocumentFallbacks() {
        Device device = new Device();
        device.getConnections().add(List.of("mac", "00:11:22:33:44:55"));

        Discovery document = DiscoveryPublisher.newDocument(
                DiscoveryOptions.builder().deviceName("hostname").build(), device, null);

        assertEquals("Mqttop", document.getDevice().getName());
        assertEquals("00:11:22:33:44:55", document.getObjectId());
    }

    @Test
    void testNewDocumentWithoutObjectId() {
        assertThrows(DiscoveryException.class,
                () -> DiscoveryPublisher.newDocument(DiscoveryOptions.builder().build(), new Device(), null));
    }

    // ==================== 发布方式 ====================

    @Test
    void testPublishDevice() throws Exception {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.DEVICE));

        publisher.publish(false, cancelled);

        assertEquals(1, client.getPublished().size());
        PublishedMessage message = client.getPublished(DEVICE_TOPIC).get(0);
        assertTrue(message.isRetained());
        JsonNode payload = objectMapper.readTree(message.getPayload());
        assertTrue(payload.get("cmps").has("mqttop_cpu"));
        assertTrue(payload.get("cmps").has("mqttop_memory"));
        assertEquals("sensor", payload.get("cmps").get("mqttop_cpu").get("p").asText());
    }

    @Test
    void testPublishDeviceWithMigration() {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.DEVICE));

        publisher.publish(true, cancelled);

        List<PublishedMessage> cpu = client.getPublished("homeassistant/sensor/mqttop/mqttop_cpu/config");
        assertEquals(2, cpu.size());
        assertEquals("{\"migrate_discovery\": true}", cpu.get(0).getPayloadAsString());
        assertEquals("", cpu.get(1).getPayloadAsString());

        List<String> operations = client.getOperations();
        int migrate = operations.indexOf("PUBLISH homeassistant/sensor/mqttop/mqttop_cpu/config");
        int device = operations.indexOf("PUBLISH " + DEVICE_TOPIC);
        int clear = operations.lastIndexOf("PUBLISH homeassistant/sensor/mqttop/mqttop_cpu/config");
        assertTrue(migrate < device);
        assertTrue(device < clear);
    }

    @Test
    void testPublishComponents() throws Exception {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.COMPONENTS));
        publisher.getDiscovery().getComponents().put("mqttop_disk_old", Component.placeholder("sensor"));

        publisher.publish(false, cancelled);

        JsonNode cpu = objectMapper.readTree(
                client.getPublished("homeassistant/sensor/mqttop/mqttop_cpu/config").get(0).getPayload());
        assertFalse(cpu.has("p"));
        assertEquals("CPU", cpu.get("name").asText());
        assertEquals("mqttop", cpu.get("o").get("name").asText());
        assertEquals("Host", cpu.get("dev").get("name").asText());
        assertEquals("", client.getPublished("homeassistant/sensor/mqttop/mqttop_disk_old/config").get(0).getPayloadAsString());
        assertTrue(client.getPublished(DEVICE_TOPIC).isEmpty());
    }

    @Test
    void testPublishComponentsWithMigration() {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.COMPONENTS));

        publisher.publish(true, cancelled);

        List<PublishedMessage> device = client.getPublished(DEVICE_TOPIC);
        assertEquals(2, device.size());
        assertEquals("{\"migrate_discovery\": true}", device.get(0).getPayloadAsString());
        assertEquals("", device.get(1).getPayloadAsString());
        assertEquals("PUBLISH " + DEVICE_TOPIC, client.getOperations().get(0));
    }

    @Test
    void testPublishNodes() throws Exception {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.NODES));

        publisher.publish(false, cancelled);

        assertEquals(2, client.getPublished().size());
        JsonNode cpu = objectMapper.readTree(
                client.getPublished("homeassistant/device/mqttop_cpu/host1/config").get(0).getPayload());
        assertEquals(1, cpu.get("cmps").size());
        assertTrue(cpu.get("cmps").has("mqttop_cpu"));
        JsonNode memory = objectMapper.readTree(
                client.getPublished("homeassistant/device/mqttop_memory/host1/config").get(0).getPayload());
        assertTrue(memory.get("cmps").has("mqttop_memory"));
    }

    @Test
    void testPublishSubsetOfNodes() {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.NODES));

        publisher.publish(false, cancelled, List.of("memory"));

        assertEquals(1, client.getPublished().size());
        assertEquals(1, client.getPublished("homeassistant/device/mqttop_memory/host1/config").size());
    }

    @Test
    void testPublishFailure() {
        client.failPublish(topic -> true);
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.DEVICE));

        assertThrows(DiscoveryException.class, () -> publisher.publish(false, cancelled));
    }

    @Test
    void testPublishAfterCancel() {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.NODES));
        cancelled.complete(null);

        publisher.publish(false, cancelled);

        assertTrue(client.getPublished().isEmpty());
    }

    // ==================== 重新发现 ====================

    @Test
    void testRediscoverPublishesPlaceholdersThenPrunes() throws Exception {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.NODES));
        Discovery document = publisher.getDiscovery();
        document.addComponent("disks", "mqttop_disk_sda", sensor("sda"));
        document.addComponent("disks", "mqttop_disk_sdb", sensor("sdb"));

        publisher.rediscover("disks", d -> d.addComponent("disks", "mqttop_disk_sda", sensor("sda")), cancelled);

        List<PublishedMessage> published = client.getPublished();
        assertEquals(1, published.size());
        assertEquals("homeassistant/device/mqttop_disks/host1/config", published.get(0).getTopic());
        JsonNode cmps = objectMapper.readTree(published.get(0).getPayload()).get("cmps");
        assertEquals("sda", cmps.get("mqttop_disk_sda").get("name").asText());
        assertEquals(1, cmps.get("mqttop_disk_sdb").size());

        assertEquals(List.of("mqttop_disk_sda"), document.getNode("disks"));
        assertNull(document.getComponent("mqttop_disk_sdb"));
        assertNotNull(document.getComponent("mqttop_cpu"));
    }

    @Test
    void testRediscoverPrunesEvenWhenPublishFails() {
        DiscoveryPublisher publisher = publisher(options(DiscoveryMethod.NODES));
        client.failPublish(topic -> true);

        assertThrows(DiscoveryException.class, () -> publisher.rediscover("cpu", d -> { }, cancelled));

        assertTrue(publisher.getDiscovery().getNode("cpu").isEmpty());
        assertNull(publisher.getDiscovery().getComponent("mqttop_cpu"));
    }

    // ==================== 等待门与刷新 ====================

    @Test
    void testWaitTopicGatesFirstPublish() throws Exception {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .method(DiscoveryMethod.NODES)
                .waitTopic("homeassistant/status")
                .waitPayload("online")
                .waitTimeout(Duration.ofSeconds(10))
                .build();
        DiscoveryPublisher publisher = publisher(options);

        CompletableFuture<Void> publishing = CompletableFuture.runAsync(() -> publisher.publish(false, cancelled));
        await().atMost(5, TimeUnit.SECONDS).until(() -> client.isSubscribed("homeassistant/status"));

        client.deliver("homeassistant/status", "offline");
        Thread.sleep(100);
        assertFalse(publishing.isDone());
        assertTrue(client.getPublished().isEmpty());

        client.deliver("homeassistant/status", "online");
        publishing.get(5, TimeUnit.SECONDS);

        assertEquals(2, client.getPublished().size());
        assertFalse(client.isSubscribed("homeassistant/status"));

        // 只等待一次
        client.clear();
        publisher.publish(false, cancelled);
        assertEquals(2, client.getPublished().size());
    }

    @Test
    void testWaitTopicTimeout() {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .method(DiscoveryMethod.NODES)
                .waitTopic("homeassistant/status")
                .waitTimeout(Duration.ofMillis(50))
                .build();
        DiscoveryPublisher publisher = publisher(options);

        publisher.publish(false, cancelled);

        assertEquals(2, client.getPublished().size());
    }

    @Test
    void testCancelWhileWaiting() throws Exception {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .waitTopic("homeassistant/status")
                .waitTimeout(Duration.ofSeconds(10))
                .build();
        DiscoveryPublisher publisher = publisher(options);

        CompletableFuture<Void> publishing = CompletableFuture.runAsync(() -> publisher.publish(false, cancelled));
        await().atMost(5, TimeUnit.SECONDS).until(() -> client.isSubscribed("homeassistant/status"));
        cancelled.complete(null);

        publishing.get(5, TimeUnit.SECONDS);
        assertTrue(client.getPublished().isEmpty());
    }

    @Test
    void testSubscribeRefreshOnWaitTopic() {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .waitTopic("homeassistant/status")
                .waitPayload("online")
                .refreshDelay(Duration.ofMillis(10))
                .build();
        DiscoveryPublisher publisher = publisher(options);
        AtomicInteger refreshes = new AtomicInteger();

        assertNull(publisher.subscribeRefresh(refreshes::incrementAndGet, scheduler).await());
        client.deliver("homeassistant/status", "offline");
        client.deliver("homeassistant/status", "online");
        client.deliver("homeassistant/status", "online");

        await().atMost(5, TimeUnit.SECONDS).until(() -> refreshes.get() == 2);
    }

    @Test
    void testSubscribeRefreshWithoutWaitTopicRunsOnce() {
        DiscoveryOptions options = DiscoveryOptions.builder()
                .refreshDelay(Duration.ofMillis(10))
                .build();
        DiscoveryPublisher publisher = publisher(options);
        AtomicInteger refreshes = new AtomicInteger();

        publisher.subscribeRefresh(refreshes::incrementAndGet, scheduler);

        await().atMost(5, TimeUnit.SECONDS).until(() -> refreshes.get() == 1);
        assertTrue(client.getOperations().isEmpty());
    }

    private DiscoveryPublisher publisher(DiscoveryOptions options) {
        Discovery document = DiscoveryPublisher.newDocument(options, device("Host", "host1"), "mqttop/bridge/status");
        document.addComponent("cpu", "mqttop_cpu", sensor("CPU"));
        document.addComponent("memory", "mqttop_memory", sensor("Memory"));
        return new DiscoveryPublisher(client, document, options);
    }

    private static DiscoveryOptions options(DiscoveryMethod method) {
        return DiscoveryOptions.builder().method(method).build();
    }

    private static Device device(String name, String... identifiers) {
        Device device = new Device();
        device.setName(name);
        device.getIdentifiers().addAll(List.of(identifiers));
        return device;
    }

    private static Component sensor(String name) {
        return new Component(Platform.SENSOR)
                .with(ComponentOption.NAME, name)
                .with(ComponentOption.STATE_TOPIC, "mqttop/metric/" + name.toLowerCase());
    }
}
