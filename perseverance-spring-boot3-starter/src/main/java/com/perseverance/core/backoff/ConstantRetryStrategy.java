package com.perseverance.core.backoff;

import com.perseverance.core.spi.NamedRetryStrategy;
import com.perseverance.model.Delay;

/**
 * 固定间隔策略
 * 设置了 maxCount 时, 超过 maxCount 次尝试后返回 STOP
 */
public class ConstantRetryStrategy implements NamedRetryStrategy {

    private final Delay delay;

    /** null 表示不限次数 */
    private final Integer maxCount;

    public ConstantRetryStrategy(long delayMillis) {
        this(delayMillis, null);
    }

    public ConstantRetryStrategy(long delayMillis, Integer maxCount) {
        if (maxCount != null && maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be >= 1");
        }
        this.delay = Delay.ofMillis(delayMillis);
        this.maxCount = maxCount;
    }

    @Override
    public String name() {
        return "constant";
    }

    @Override
    public Delay delay(int attempt) {
        if (maxCount != null && attempt > maxCount) {
            return Delay.STOP;
        }
        return delay;
    }

    @Override
    public String toString() {
        return "constant(" + delay + (maxCount == null ? "" : ", maxCount=" + maxCount) + ")";
    }
}
