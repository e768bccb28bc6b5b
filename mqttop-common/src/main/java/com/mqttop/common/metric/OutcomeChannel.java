/**
 * 更新结果通道
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 指标推送更新结果的有界通道
 * 
 * 队列满时丢弃最旧的结果；关闭后剩余结果仍可被取出，取空后 receive() 返回空。
 */
public class OutcomeChannel {
    
    /**
     * 默认容量
     */
    public static final int DEFAULT_CAPACITY = 16;
    
    private final ReentrantLock lock = new ReentrantLock();
    
    private final Condition notEmpty = lock.newCondition();
    
    private final Deque<UpdateOutcome> queue = new ArrayDeque<>();
    
    private final int capacity;
    
    private boolean closed;
    
    private long dropped;
    
    public OutcomeChannel() {
        this(DEFAULT_CAPACITY);
    }
    
    public OutcomeChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }
    
    /**
     * 发送结果
     *
     * @param outcome 更新结果
     * @return 通道已关闭返回false
     */
    public boolean send(UpdateOutcome outcome) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped++;
            }
            queue.offerLast(outcome);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 阻塞接收结果
     *
     * @return 结果；通道已关闭且取空时返回空
     * @throws InterruptedException 等待时被中断
     */
    public Optional<UpdateOutcome> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 限时接收结果
     *
     * @param timeout 超时时间
     * @param unit 时间单位
     * @return 结果；超时或通道已关闭且取空时返回空
     * @throws InterruptedException 等待时被中断
     */
    public Optional<UpdateOutcome> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 关闭通道并唤醒所有接收者
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
    
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
    
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 因队列满而丢弃的结果数
     */
    public long getDropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }
}
