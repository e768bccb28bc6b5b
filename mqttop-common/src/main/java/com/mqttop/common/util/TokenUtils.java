/**
 * 令牌等待工具类
 *
 * @author zhenglin
 * @date 2025/08/12
 */
package com.mqttop.common.util;

import com.mqttop.common.client.Token;

import java.util.concurrent.CompletableFuture;

/**
 * 在令牌完成与取消信号之间竞争等待
 * 取消总是优先：取消后的等待结果视为放弃，不视为失败
 */
public final class TokenUtils {
    
    private TokenUtils() {
    }
    
    /**
     * 等待令牌完成或取消
     *
     * @param token 操作令牌
     * @param cancelled 取消信号
     * @return 操作错误；成功或被取消时返回null
     */
    public static Throwable awaitOrCancelled(Token token, CompletableFuture<?> cancelled) {
        if (isCancelled(cancelled)) {
            return null;
        }
        CompletableFuture.anyOf(token.done(), cancelled).join();
        if (isCancelled(cancelled)) {
            return null;
        }
        return token.error();
    }
    
    /**
     * 检查取消信号是否已触发
     *
     * @param cancelled 取消信号
     * @return 已取消返回true
     */
    public static boolean isCancelled(CompletableFuture<?> cancelled) {
        return cancelled != null && cancelled.isDone();
    }
}
