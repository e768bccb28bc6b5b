/**
 * 指标到代理的桥接器
 *
 * @author zhenglin
 * @date 2025/08/17
 */
package com.mqttop.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.client.BrokerClient;
import com.mqttop.common.client.MessageHandler;
import com.mqttop.common.client.Token;
import com.mqttop.common.client.WillOptions;
import com.mqttop.common.discovery.Component;
import com.mqttop.common.discovery.ComponentOption;
import com.mqttop.common.discovery.Discoverer;
import com.mqttop.common.discovery.Discovery;
import com.mqttop.common.discovery.Platform;
import com.mqttop.common.metric.Metric;
import com.mqttop.common.metric.MetricException;
import com.mqttop.common.metric.Reconfigurable;
import com.mqttop.common.metric.SelectionModeConfigurable;
import com.mqttop.common.metric.UpdateOutcome;
import com.mqttop.common.protocol.MqttQos;
import com.mqttop.common.util.MetricsUtils;
import com.mqttop.common.util.TokenUtils;
import com.mqttop.core.discovery.DiscoveryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 指标到代理的桥接器
 *
 * 持有代理连接，启动和停止每个指标，把各指标事件循环的更新汇入一个串行的发布循环，
 * 维护每个主题的存活状态，并驱动自动发现与增量重新发现。
 *
 * 线程模型：
 * 1. 一个启动线程执行启动序列
 * 2. 每个已加载指标一个事件循环线程
 * 3. 一个发布循环线程，是中央事件队列的唯一消费者
 * 4. 控制线程池处理代理回调中的更新和停止请求，不阻塞客户端回调线程
 */
@Slf4j
public class Bridge {
    
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    
    private static final String BRIDGE_NODE = "bridge";
    
    private static final String UPDATE_SUFFIX = "/update";
    
    private static final String STOP_SUFFIX = "/stop";
    
    private static final String BRIDGE_AVAILABILITY_TEMPLATE = "{{ iif(value == 'offline', value, 'online') }}";
    
    private static final long EVENT_POLL_MILLIS = 100;
    
    private final BrokerClient client;
    
    private final BridgeOptions options;
    
    /**
     * 发现发布器，未启用发现时为null
     */
    private final DiscoveryPublisher discovery;
    
    private final boolean migrate;
    
    private final StateMap states = new StateMap();
    
    /**
     * 指标槽位，指标停止后槽位置为null
     */
    private final List<Metric> metrics = new ArrayList<>();
    
    private final ReentrantLock lock = new ReentrantLock();
    
    /**
     * 启动序列是否已遍历完指标列表，受lock保护
     */
    private boolean iterated;
    
    private final Set<Metric> loaded = ConcurrentHashMap.newKeySet();
    
    private final BlockingQueue<BridgeEvent> events;
    
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
    
    private final AtomicBoolean started = new AtomicBoolean(false);
    
    private final AtomicBoolean finished = new AtomicBoolean(false);
    
    private final AtomicReference<Throwable> startupError = new AtomicReference<>();
    
    /**
     * 最近一次指标发布的令牌，只有它的错误会被记录
     */
    private final AtomicReference<Token> lastPublish = new AtomicReference<>();
    
    private final CustomizableThreadFactory bridgeThreads = new CustomizableThreadFactory("mqttop-bridge-");
    
    private final ExecutorService metricLoops;
    
    private final ExecutorService control;
    
    private final ScheduledExecutorService scheduler;
    
    public Bridge(BrokerClient client, List<? extends Metric> metrics, BridgeOptions options) {
        this(client, metrics, options, null, false);
    }
    
    /**
     * 创建桥接器
     *
     * @param client 代理客户端
     * @param metrics 指标列表
     * @param options 桥接器选项
     * @param discovery 发现发布器，null表示不启用发现
     * @param migrate 首次发现发布是否需要迁移
     */
    public Bridge(BrokerClient client, List<? extends Metric> metrics, BridgeOptions options,
                  DiscoveryPublisher discovery, boolean migrate) {
        this.client = Objects.requireNonNull(client, "client");
        this.options = options != null ? options : BridgeOptions.defaults();
        this.discovery = discovery;
        this.migrate = migrate;
        this.metrics.addAll(metrics);
        this.events = new LinkedBlockingQueue<>(this.options.getQueueCapacity());
        
        this.metricLoops = Executors.newCachedThreadPool(new CustomizableThreadFactory("mqttop-metric-"));
        CustomizableThreadFactory controlThreads = new CustomizableThreadFactory("mqttop-control-");
        controlThreads.setDaemon(true);
        this.control = Executors.newCachedThreadPool(controlThreads);
        CustomizableThreadFactory schedulerThreads = new CustomizableThreadFactory("mqttop-scheduler-");
        schedulerThreads.setDaemon(true);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(schedulerThreads);
        
        // 取消时中断阻塞在结果通道上的指标事件循环
        cancelled.thenRun(metricLoops::shutdownNow);
    }
    
    // ==================== 生命周期 ====================
    
    /**
     * 启动桥接器
     *
     * 连接代理后立即返回，剩余启动序列异步执行并在完成时完成 {@link #ready()}。
     *
     * @throws BridgeException 没有配置指标或首次连接失败
     */
    public void start() {
        lock.lock();
        try {
            if (metrics.isEmpty()) {
                throw new BridgeException("no metrics");
            }
        } finally {
            lock.unlock();
        }
        if (!started.compareAndSet(false, true)) {
            log.debug("桥接器已启动，忽略重复启动");
            return;
        }
        
        log.info("连接代理...");
        Throwable error = TokenUtils.awaitOrCancelled(client.connect(), cancelled);
        if (error != null) {
            log.error("连接代理失败", error);
            finish();
            throw new BridgeException("连接代理失败", error);
        }
        if (isCancelled()) {
            log.info("连接期间桥接器被取消");
            finish();
            return;
        }
        
        bridgeThreads.newThread(this::runStartup).start();
    }
    
    /**
     * 停止桥接器并等待关闭完成，可重复调用
     */
    public void stop() {
        log.debug("停止桥接器");
        if (!started.get()) {
            return;
        }
        CompletableFuture.anyOf(ready, done).join();
        cancel();
        done.join();
    }
    
    /**
     * 发出取消信号，不等待就绪
     *
     * @return 本次调用触发了取消返回true
     */
    public boolean cancel() {
        boolean first = cancelled.complete(null);
        if (first) {
            log.info("桥接器取消");
        }
        return first;
    }
    
    public CompletableFuture<Void> ready() {
        return ready;
    }
    
    public CompletableFuture<Void> done() {
        return done;
    }
    
    public boolean isCancelled() {
        return cancelled.isDone();
    }
    
    /**
     * 启动序列中的第一个错误
     *
     * @return 错误
     */
    public Optional<Throwable> getStartupError() {
        return Optional.ofNullable(startupError.get());
    }
    
    public StateMap getStates() {
        return states;
    }
    
    /**
     * 当前槽位快照，包含已停止指标留下的null
     *
     * @return 槽位快照
     */
    public List<Metric> getMetrics() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(metrics));
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<DiscoveryPublisher> getDiscovery() {
        return Optional.ofNullable(discovery);
    }
    
    // ==================== 启动序列 ====================
    
    /**
     * 添加指标
     *
     * 启动序列遍历完成前追加到列表由启动序列启动，之后立即启动并触发重新发现。
     *
     * @param metric 指标
     */
    public void addMetric(Metric metric) {
        int index;
        lock.lock();
        try {
            if (isCancelled() || done.isDone()) {
                log.warn("桥接器已停止，忽略新增指标: type={}, topic={}", metric.getType(), metric.getTopic());
                return;
            }
            metrics.add(metric);
            if (!iterated) {
                return;
            }
            index = metrics.size() - 1;
        } finally {
            lock.unlock();
        }
        log.info("热添加指标: type={}, topic={}", metric.getType(), metric.getTopic());
        startMetric(index, metric, true);
    }
    
    private void runStartup() {
        try {
            startMetrics();
            if (isCancelled()) {
                log.info("启动序列被取消");
                finish();
                return;
            }
            
            recordError(TokenUtils.awaitOrCancelled(publishStates(false), cancelled), "发布状态失败");
            
            String base = options.getBaseTopic();
            recordError(TokenUtils.awaitOrCancelled(client.subscribe(base + "/bridge/stop", MqttQos.AT_MOST_ONCE,
                    (c, message) -> runControl(this::stop)), cancelled), "订阅桥接器停止主题失败");
            recordError(TokenUtils.awaitOrCancelled(client.subscribe(base + "/bridge/update", MqttQos.AT_MOST_ONCE,
                    (c, message) -> runControl(this::update)), cancelled), "订阅桥接器更新主题失败");
            
            if (discovery != null && !isCancelled()) {
                try {
                    discover();
                } catch (RuntimeException e) {
                    recordError(e, "发布发现文档失败");
                }
            }
        } catch (RuntimeException e) {
            log.error("启动序列异常", e);
            startupError.compareAndSet(null, e);
            cancel();
        }
        
        if (isCancelled()) {
            finish();
            return;
        }
        log.info("桥接器就绪: metrics={}, states={}", loaded.size(), states.snapshot());
        ready.complete(null);
        bridgeThreads.newThread(this::runPublishLoop).start();
    }
    
    private void startMetrics() {
        int index = 0;
        while (true) {
            Metric metric;
            lock.lock();
            try {
                if (isCancelled() || index >= metrics.size()) {
                    iterated = true;
                    return;
                }
                metric = metrics.get(index);
            } finally {
                lock.unlock();
            }
            startMetric(index, metric, false);
            index++;
        }
    }
    
    /**
     * 启动单个指标并运行其事件循环
     */
    private void startMetric(int index, Metric metric, boolean rediscover) {
        String topic = metric.getTopic();
        if (topic == null || topic.isEmpty()) {
            log.debug("指标没有主题，跳过: type={}", metric.getType());
            return;
        }
        
        try {
            metric.start();
        } catch (MetricException | RuntimeException e) {
            log.error("启动指标失败: type={}, topic={}", metric.getType(), topic, e);
            states.put(topic, false);
            clearSlot(index, metric);
            return;
        }
        states.put(topic, true);
        
        Map<String, MqttQos> filters = new LinkedHashMap<>();
        filters.put(topic + UPDATE_SUFFIX, MqttQos.AT_MOST_ONCE);
        filters.put(topic + STOP_SUFFIX, MqttQos.AT_MOST_ONCE);
        Throwable error = TokenUtils.awaitOrCancelled(client.subscribeMultiple(filters, metricHandler(metric)), cancelled);
        if (error != null) {
            log.error("订阅指标控制主题失败: topic={}", topic, error);
            metric.stop();
            states.put(topic, false);
            clearSlot(index, metric);
            return;
        }
        
        try {
            metricLoops.execute(() -> loopMetric(index, metric));
        } catch (RejectedExecutionException e) {
            log.debug("桥接器已取消，不再启动指标事件循环: topic={}", topic);
            metric.stop();
            return;
        }
        loaded.add(metric);
        MetricsUtils.incrementLoadedMetrics();
        log.info("指标已启动: type={}, topic={}", metric.getType(), topic);
        
        if (rediscover && discovery != null) {
            send(new BridgeEvent(BridgeEvent.Type.REDISCOVER, metric));
        }
    }
    
    private void clearSlot(int index, Metric metric) {
        lock.lock();
        try {
            if (index < metrics.size() && metrics.get(index) == metric) {
                metrics.set(index, null);
            }
        } finally {
            lock.unlock();
        }
    }
    
    private void recordError(Throwable error, String message) {
        if (error == null) {
            return;
        }
        log.error(message, error);
        startupError.compareAndSet(null, error);
    }
    
    // ==================== 指标事件循环 ====================
    
    private void loopMetric(int index, Metric metric) {
        String topic = metric.getTopic();
        int failures = 0;
        boolean interrupted = false;
        try {
            while (!isCancelled()) {
                Optional<UpdateOutcome> outcome = metric.updated().receive();
                if (outcome.isEmpty()) {
                    break;
                }
                failures = handleOutcome(metric, outcome.get(), failures);
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            metric.stop();
            states.remove(topic);
            clearSlot(index, metric);
            loaded.remove(metric);
            MetricsUtils.decrementLoadedMetrics();
            log.info("指标事件循环退出: type={}, topic={}", metric.getType(), topic);
            
            if (!isCancelled()) {
                Throwable error = TokenUtils.awaitOrCancelled(
                        client.unsubscribe(topic + UPDATE_SUFFIX, topic + STOP_SUFFIX), cancelled);
                if (error != null) {
                    log.warn("取消订阅指标控制主题失败: topic={}, error={}", topic, error.getMessage());
                }
                error = TokenUtils.awaitOrCancelled(publishStates(false), cancelled);
                if (error != null) {
                    log.warn("发布状态失败: error={}", error.getMessage());
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
    
    /**
     * 分类处理一次更新结果
     *
     * @return 处理后的连续失败次数
     */
    private int handleOutcome(Metric metric, UpdateOutcome outcome, int failures) {
        switch (outcome.getKind()) {
            case CHANGED:
                updateState(metric, true);
                send(new BridgeEvent(BridgeEvent.Type.UPDATE, metric));
                return 0;
            case UNCHANGED:
                if (updateState(metric, true)) {
                    send(new BridgeEvent(BridgeEvent.Type.UPDATE, metric));
                }
                return 0;
            case RESCANNED:
                updateState(metric, true);
                if (discovery != null) {
                    send(new BridgeEvent(BridgeEvent.Type.REDISCOVER, metric));
                }
                return 0;
            case FAILED:
            default:
                log.warn("更新指标失败: type={}, topic={}, error={}", metric.getType(), metric.getTopic(),
                        outcome.getCause() != null ? outcome.getCause().getMessage() : null);
                int count = failures + 1;
                if (options.getFailureThreshold() > 0 && count == options.getFailureThreshold()) {
                    log.warn("指标连续失败达到阈值，标记为离线: topic={}, failures={}", metric.getTopic(), count);
                    updateState(metric, false);
                }
                return count;
        }
    }
    
    /**
     * 切换指标状态，发生切换时发布状态表
     *
     * @return 发生切换返回true
     */
    private boolean updateState(Metric metric, boolean online) {
        String topic = metric.getTopic();
        if (!states.transition(topic, online)) {
            return false;
        }
        log.debug("状态变化: topic={}, from={}, to={}", topic, !online, online);
        Throwable error = TokenUtils.awaitOrCancelled(publishStates(false), cancelled);
        if (error != null) {
            log.warn("发布状态失败: error={}", error.getMessage());
        }
        return true;
    }
    
    /**
     * 把事件放入中央队列，队列满时等待，取消时放弃
     */
    private boolean send(BridgeEvent event) {
        try {
            while (!isCancelled()) {
                if (events.offer(event, EVENT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }
    
    // ==================== 控制主题 ====================
    
    private MessageHandler metricHandler(Metric metric) {
        return (c, message) -> {
            String topic = message.getTopic();
            if (topic.endsWith(UPDATE_SUFFIX)) {
                byte[] payload = message.getPayload();
                runControl(() -> handleUpdateRequest(metric, payload));
            } else if (topic.endsWith(STOP_SUFFIX)) {
                log.info("收到指标停止请求: topic={}", metric.getTopic());
                runControl(metric::stop);
            }
        };
    }
    
    private void runControl(Runnable task) {
        try {
            control.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("桥接器已关闭，忽略控制请求");
        }
    }
    
    private void handleUpdateRequest(Metric metric, byte[] payload) {
        applyUpdatePayload(metric, payload);
        UpdateOutcome outcome;
        try {
            outcome = metric.update();
        } catch (RuntimeException e) {
            outcome = UpdateOutcome.failed(e);
        }
        switch (outcome.getKind()) {
            case CHANGED:
                send(new BridgeEvent(BridgeEvent.Type.UPDATE, metric));
                break;
            case RESCANNED:
                if (discovery != null) {
                    send(new BridgeEvent(BridgeEvent.Type.REDISCOVER, metric));
                }
                break;
            case FAILED:
                log.warn("更新指标失败: topic={}, error={}", metric.getTopic(),
                        outcome.getCause() != null ? outcome.getCause().getMessage() : null);
                break;
            default:
                break;
        }
    }
    
    /**
     * 应用更新请求中的配置 {"interval": "5s", "selection_mode": "process"}
     * 负载无效时记录日志，不影响后续的更新
     */
    static void applyUpdatePayload(Metric metric, byte[] payload) {
        if (payload == null || payload.length == 0) {
            return;
        }
        Map<String, String> fields;
        try {
            fields = OBJECT_MAPPER.readValue(payload, new TypeReference<Map<String, String>>() {
            });
        } catch (IOException e) {
            log.warn("无效的更新负载: topic={}, error={}", metric.getTopic(), e.getMessage());
            return;
        }
        if (fields == null) {
            return;
        }
        
        String interval = fields.get("interval");
        if (interval != null) {
            Optional<Reconfigurable> reconfigurable = metric.capability(Reconfigurable.class);
            if (reconfigurable.isPresent()) {
                try {
                    Duration duration = DurationParser.parse(interval);
                    reconfigurable.get().setInterval(duration);
                    log.info("指标刷新间隔已修改: topic={}, interval={}", metric.getTopic(), duration);
                } catch (IllegalArgumentException e) {
                    log.warn("无效的刷新间隔: topic={}, interval={}, error={}", metric.getTopic(), interval, e.getMessage());
                }
            }
        }
        
        String mode = fields.get("selection_mode");
        if (mode != null) {
            metric.capability(SelectionModeConfigurable.class).ifPresent(c -> c.setSelectionMode(mode));
        }
    }
    
    /**
     * 刷新全部已加载指标
     */
    public void update() {
        List<Metric> snapshot = new ArrayList<>();
        lock.lock();
        try {
            for (Metric metric : metrics) {
                if (metric != null && loaded.contains(metric)) {
                    snapshot.add(metric);
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("刷新全部指标: count={}", snapshot.size());
        
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Metric metric : snapshot) {
            if (isCancelled()) {
                break;
            }
            try {
                futures.add(CompletableFuture.runAsync(() -> refresh(metric), control));
            } catch (RejectedExecutionException e) {
                log.debug("桥接器已关闭，停止刷新");
                break;
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }
    
    private void refresh(Metric metric) {
        UpdateOutcome outcome;
        try {
            outcome = metric.update();
        } catch (RuntimeException e) {
            outcome = UpdateOutcome.failed(e);
        }
        if (outcome.isFailed()) {
            // 失败只记录日志，状态由事件循环的失败阈值决定
            log.warn("更新指标失败: type={}, error={}", metric.getType(),
                    outcome.getCause() != null ? outcome.getCause().getMessage() : null);
            return;
        }
        updateState(metric, true);
        switch (outcome.getKind()) {
            case RESCANNED:
                if (discovery != null) {
                    send(new BridgeEvent(BridgeEvent.Type.REDISCOVER, metric));
                }
                break;
            default:
                send(new BridgeEvent(BridgeEvent.Type.UPDATE, metric));
                break;
        }
    }
    
    // ==================== 发布循环 ====================
    
    private void runPublishLoop() {
        try {
            while (!isCancelled()) {
                BridgeEvent event = events.poll(EVENT_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event == null || isCancelled()) {
                    continue;
                }
                if (event.getType() == BridgeEvent.Type.UPDATE) {
                    publishUpdate(event.getMetric());
                } else {
                    publishRediscovery(event.getMetric());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finish();
        }
    }
    
    private void publishUpdate(Metric metric) {
        byte[] payload;
        try {
            payload = metric.toPayload();
        } catch (MetricException | RuntimeException e) {
            log.warn("序列化指标失败: type={}, error={}", metric.getType(), e.getMessage());
            MetricsUtils.recordFailedUpdate();
            return;
        }
        Token token = client.publish(metric.getTopic(), MqttQos.AT_MOST_ONCE, false, payload);
        MetricsUtils.recordPublishedUpdate();
        lastPublish.set(token);
        token.done().thenRun(() -> {
            if (lastPublish.compareAndSet(token, null) && token.error() != null) {
                log.warn("发布指标更新失败: topic={}, error={}", metric.getTopic(), token.error().getMessage());
                MetricsUtils.recordFailedUpdate();
            }
        });
    }
    
    private void publishRediscovery(Metric metric) {
        Optional<Discoverer> discoverer = metric.capability(Discoverer.class);
        if (discovery == null || discoverer.isEmpty()) {
            return;
        }
        log.debug("重新发现: type={}", metric.getType());
        try {
            discovery.rediscover(metric.getType(), discoverer.get(), cancelled);
        } catch (RuntimeException e) {
            log.warn("发布重新发现失败: type={}", metric.getType(), e);
        }
    }
    
    /**
     * 发布状态表或遗嘱负载到遗嘱主题
     *
     * @param will true发布遗嘱负载，false发布状态快照
     * @return 发布令牌
     */
    Token publishStates(boolean will) {
        WillOptions willOptions = client.getWillOptions();
        if (!willOptions.isEnabled()) {
            return Token.completed();
        }
        byte[] payload = will ? willOptions.getPayload() : states.toJson();
        Token token = client.publish(willOptions.getTopic(), willOptions.getQos(), willOptions.isRetained(), payload);
        if (!will) {
            MetricsUtils.recordStatesPublished();
        }
        return token;
    }
    
    // ==================== 发现 ====================
    
    private void discover() {
        Discovery document = discovery.getDiscovery();
        lock.lock();
        try {
            for (Metric metric : metrics) {
                if (metric != null && loaded.contains(metric)) {
                    metric.capability(Discoverer.class).ifPresent(d -> d.discover(document));
                }
            }
        } finally {
            lock.unlock();
        }
        announce(document);
        
        discovery.publish(migrate, cancelled);
        if (isCancelled()) {
            return;
        }
        Token token = discovery.subscribeRefresh(() -> runControl(this::update), scheduler);
        recordError(TokenUtils.awaitOrCancelled(token, cancelled), "订阅发现刷新主题失败");
    }
    
    /**
     * 桥接器自身的发现组件：触发全部指标刷新的按钮
     */
    void announce(Discovery document) {
        String id = document.getOrigin().getName() + "_update";
        Component button = new Component(Platform.BUTTON)
                .with(ComponentOption.NAME, "Update")
                .with(ComponentOption.DEVICE_CLASS, "restart")
                .with(ComponentOption.AVAILABILITY_TOPIC, document.getAvailabilityTopic())
                .with(ComponentOption.AVAILABILITY_TEMPLATE, BRIDGE_AVAILABILITY_TEMPLATE)
                .with(ComponentOption.COMMAND_TOPIC, options.getBaseTopic() + "/bridge/update")
                .with(ComponentOption.UNIQUE_ID, id);
        document.addComponent(BRIDGE_NODE, id, button);
    }
    
    // ==================== 关闭 ====================
    
    /**
     * 关闭：发布遗嘱负载、断开连接、等待全部指标事件循环退出后完成 {@link #done()}
     */
    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        cancel();
        try {
            if (client.isConnected()) {
                Throwable error = publishStates(true).await();
                if (error != null) {
                    log.warn("发布离线状态失败: error={}", error.getMessage());
                }
                client.disconnect(options.getDisconnectQuiesceMillis());
            }
            events.clear();
            metricLoops.shutdownNow();
            long timeout = options.getShutdownTimeout().toMillis();
            if (!metricLoops.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("等待指标事件循环退出超时: timeout={}ms", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待指标事件循环退出被中断");
        } finally {
            control.shutdown();
            scheduler.shutdownNow();
            log.info("桥接器已停止");
            done.complete(null);
        }
    }
}
