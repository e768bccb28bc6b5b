/**
 * 指标更新结果
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

import lombok.Getter;

/**
 * 一次指标刷新的分类结果
 */
@Getter
public final class UpdateOutcome {
    
    private static final UpdateOutcome CHANGED = new UpdateOutcome(Kind.CHANGED, null);
    
    private static final UpdateOutcome UNCHANGED = new UpdateOutcome(Kind.UNCHANGED, null);
    
    private static final UpdateOutcome RESCANNED = new UpdateOutcome(Kind.RESCANNED, null);
    
    /**
     * 结果类型
     */
    public enum Kind {
        /**
         * 值已变化
         */
        CHANGED,
        /**
         * 值未变化
         */
        UNCHANGED,
        /**
         * 子实体集合已变化，需要重新发现
         */
        RESCANNED,
        /**
         * 采集失败
         */
        FAILED
    }
    
    private final Kind kind;
    
    private final Throwable cause;
    
    private UpdateOutcome(Kind kind, Throwable cause) {
        this.kind = kind;
        this.cause = cause;
    }
    
    public static UpdateOutcome changed() {
        return CHANGED;
    }
    
    public static UpdateOutcome unchanged() {
        return UNCHANGED;
    }
    
    public static UpdateOutcome rescanned() {
        return RESCANNED;
    }
    
    public static UpdateOutcome failed(Throwable cause) {
        return new UpdateOutcome(Kind.FAILED, cause);
    }
    
    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
    
    @Override
    public String toString() {
        return cause == null ? kind.name() : kind.name() + "(" + cause.getMessage() + ")";
    }
}
