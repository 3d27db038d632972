package com.perseverance.core.spi;

/**
 * 重试回调, 每次等待之前调用
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * @param failure     包装后的失败
     * @param attempt     刚刚失败的尝试序号
     * @param delayMillis 即将等待的毫秒数
     */
    void onRetry(RuntimeException failure, int attempt, long delayMillis);

    /**
     * 策略返回 STOP, 包装后的失败即将抛出
     */
    default void onExhausted(RuntimeException failure, int attempt) {
    }
}
