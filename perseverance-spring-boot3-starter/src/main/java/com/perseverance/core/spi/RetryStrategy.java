package com.perseverance.core.spi;

import com.perseverance.model.Delay;

/**
 * 退避策略: 第几次尝试 -> 延迟 或 STOP
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * @param attempt 第几次尝试, 从 1 开始
     * @return 重试前等待的延迟, 或 {@link Delay#STOP} 表示放弃
     */
    Delay delay(int attempt);

    /**
     * 每个 ErrorToken 取一次, 结果由上下文按 token 缓存
     * 无状态策略返回自身; 有状态的自定义策略应返回新实例
     */
    default RetryStrategy fork() {
        return this;
    }
}
