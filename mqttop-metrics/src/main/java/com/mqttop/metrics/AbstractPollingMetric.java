/**
 * 轮询指标基类
 *
 * @author zhenglin
 * @date 2025/08/18
 */
package com.mqttop.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mqttop.common.metric.Metric;
import com.mqttop.common.metric.MetricException;
import com.mqttop.common.metric.OutcomeChannel;
import com.mqttop.common.metric.Reconfigurable;
import com.mqttop.common.metric.UpdateOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按固定间隔采集并推送更新结果的指标基类
 * 
 * 每个指标只能启动一次，停止后不能再启动。刷新间隔可以在运行时修改，
 * 间隔为零时停止指标。
 */
@Slf4j
public abstract class AbstractPollingMetric implements Metric, Reconfigurable {
    
    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    
    private final String type;
    
    private final String topic;
    
    private final OutcomeChannel channel = new OutcomeChannel();
    
    /**
     * 保护采集状态和调度任务
     */
    protected final ReentrantLock lock = new ReentrantLock();
    
    private final AtomicBoolean started = new AtomicBoolean(false);
    
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    
    private volatile Duration interval;
    
    private ScheduledExecutorService executor;
    
    private ScheduledFuture<?> task;
    
    /**
     * 调度代数，修改间隔后旧的调度链不再续期
     */
    private long generation;
    
    /**
     * 启动后是否已推送过结果
     */
    private volatile boolean reported;
    
    protected AbstractPollingMetric(String type, String topic, Duration interval) {
        this.type = type;
        this.topic = topic;
        this.interval = interval;
    }
    
    @Override
    public String getType() {
        return type;
    }
    
    @Override
    public String getTopic() {
        return topic;
    }
    
    public Duration getInterval() {
        return interval;
    }
    
    public boolean isRunning() {
        return started.get() && !stopped.get();
    }
    
    @Override
    public void start() throws MetricException {
        if (interval == null || interval.isZero()) {
            log.warn("刷新间隔为0，不启动指标: type={}", type);
            return;
        }
        if (stopped.get() || !started.compareAndSet(false, true)) {
            log.debug("指标已启动或已停止: type={}", type);
            return;
        }
        
        // 首次采集失败视为启动失败
        lock.lock();
        try {
            collect();
        } catch (RuntimeException e) {
            started.set(false);
            throw new MetricException("初始采集失败: " + type, e);
        } catch (MetricException e) {
            started.set(false);
            throw e;
        } finally {
            lock.unlock();
        }
        
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("mqttop-" + type + "-");
        threadFactory.setDaemon(true);
        lock.lock();
        try {
            executor = Executors.newSingleThreadScheduledExecutor(threadFactory);
            schedule();
        } finally {
            lock.unlock();
        }
        log.debug("指标开始轮询: type={}, interval={}", type, interval);
    }
    
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        lock.lock();
        try {
            if (task != null) {
                task.cancel(false);
            }
            if (executor != null) {
                executor.shutdownNow();
            }
        } finally {
            lock.unlock();
        }
        channel.close();
        log.debug("指标已停止: type={}", type);
    }
    
    @Override
    public UpdateOutcome update() {
        lock.lock();
        try {
            return collect();
        } catch (MetricException | RuntimeException e) {
            return UpdateOutcome.failed(e);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public OutcomeChannel updated() {
        return channel;
    }
    
    @Override
    public byte[] toPayload() throws MetricException {
        lock.lock();
        try {
            return OBJECT_MAPPER.writeValueAsBytes(snapshot());
        } catch (JsonProcessingException e) {
            throw new MetricException("序列化指标失败: " + type, e);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void setInterval(Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
        if (interval.isZero()) {
            stop();
            return;
        }
        lock.lock();
        try {
            boolean changed = !interval.equals(this.interval);
            this.interval = interval;
            if (changed && task != null && !stopped.get()) {
                task.cancel(false);
                schedule();
            }
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 采集一次指标值，调用时已持有lock
     *
     * @return 采集结果
     * @throws MetricException 采集失败
     */
    protected abstract UpdateOutcome collect() throws MetricException;
    
    /**
     * 当前指标值，序列化为发布负载，调用时已持有lock
     *
     * @return 可被Jackson序列化的对象
     */
    protected abstract Object snapshot();
    
    /**
     * 组件可用性模板：状态表中该主题为true时在线
     */
    protected static String availabilityTemplate(String topic) {
        return "{{ iif(value_json['" + topic + "']|default, 'online', 'offline') if value_json is defined else value }}";
    }
    
    private void schedule() {
        long current = ++generation;
        task = executor.schedule(() -> tick(current), interval.toMillis(), TimeUnit.MILLISECONDS);
    }
    
    private void tick(long scheduled) {
        if (stopped.get()) {
            return;
        }
        UpdateOutcome outcome = update();
        // 启动时的采集已经记录了当前值，第一次推送总是发布
        if (!reported && outcome.getKind() == UpdateOutcome.Kind.UNCHANGED) {
            outcome = UpdateOutcome.changed();
        }
        reported = true;
        if (outcome.isFailed()) {
            log.debug("指标采集失败: type={}, error={}", type, outcome.getCause().getMessage());
        }
        channel.send(outcome);
        lock.lock();
        try {
            if (!stopped.get() && scheduled == generation) {
                schedule();
            }
        } finally {
            lock.unlock();
        }
    }
}
