/**
 * 代理异步操作令牌
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

import java.util.concurrent.CompletableFuture;

/**
 * 表示一次正在进行的代理操作（连接、发布、订阅、取消订阅）
 * 
 * done() 返回的Future在操作结束时总是正常完成，失败原因通过 error() 获取
 */
public interface Token {
    
    /**
     * 操作完成信号
     *
     * @return 操作结束时正常完成的Future
     */
    CompletableFuture<Void> done();
    
    /**
     * 获取操作错误
     *
     * @return 操作失败原因，未完成或成功时返回null
     */
    Throwable error();
    
    /**
     * 检查操作是否已结束
     *
     * @return 已结束返回true
     */
    default boolean isDone() {
        return done().isDone();
    }
    
    /**
     * 阻塞等待操作结束
     *
     * @return 操作错误，成功时返回null
     */
    default Throwable await() {
        done().join();
        return error();
    }
    
    /**
     * 包装一个异步结果
     *
     * @param future 异步结果
     * @return 令牌
     */
    static Token of(CompletableFuture<?> future) {
        return new FutureToken(future);
    }
    
    /**
     * 已成功完成的令牌
     *
     * @return 令牌
     */
    static Token completed() {
        return new FutureToken(CompletableFuture.completedFuture(null));
    }
    
    /**
     * 已失败的令牌
     *
     * @param cause 失败原因
     * @return 令牌
     */
    static Token failed(Throwable cause) {
        return new FutureToken(CompletableFuture.failedFuture(cause));
    }
}
