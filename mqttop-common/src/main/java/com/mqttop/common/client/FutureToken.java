/**
 * 基于CompletableFuture的令牌实现
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 将客户端库返回的CompletableFuture适配为令牌
 */
public final class FutureToken implements Token {
    
    private final CompletableFuture<?> source;
    
    private final CompletableFuture<Void> done;
    
    FutureToken(CompletableFuture<?> source) {
        this.source = source;
        this.done = source.handle((result, ex) -> null);
    }
    
    @Override
    public CompletableFuture<Void> done() {
        return done;
    }
    
    @Override
    public Throwable error() {
        if (!source.isDone() || !source.isCompletedExceptionally()) {
            return null;
        }
        try {
            source.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (RuntimeException e) {
            return e;
        }
    }
}
