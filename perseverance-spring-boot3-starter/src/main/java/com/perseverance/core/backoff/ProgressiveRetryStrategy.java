package com.perseverance.core.backoff;

import com.perseverance.core.spi.NamedRetryStrategy;
import com.perseverance.model.Delay;
import lombok.Builder;
import lombok.Getter;

/**
 * 递增间隔策略
 * - 前 stableLength 次尝试返回 initialDelay
 * - 之后每次乘以 multiplier（倍数取整）, 不超过 maxDelay
 * - 设置了 maxCount 且超过时返回 STOP
 *
 * 例 initialDelay=1000, stableLength=4, multiplier=2, maxDelay=10000:
 * 1~4 -> 1000, 5 -> 2000, 6 -> 4000, 7 -> 8000, 8+ -> 10000
 */
@Getter
public class ProgressiveRetryStrategy implements NamedRetryStrategy {

    public static final long DEFAULT_INITIAL_DELAY = 500L;
    public static final int DEFAULT_STABLE_LENGTH = 3;
    public static final double DEFAULT_MULTIPLIER = 2;
    public static final long DEFAULT_MAX_DELAY = 60_000L;

    private final long initialDelay;
    private final int stableLength;
    private final double multiplier;
    private final long maxDelay;
    private final Integer maxCount;

    public ProgressiveRetryStrategy() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_STABLE_LENGTH, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, null);
    }

    @Builder
    public ProgressiveRetryStrategy(Long initialDelay, Integer stableLength, Double multiplier,
                                    Long maxDelay, Integer maxCount) {
        this.initialDelay = initialDelay != null ? initialDelay : DEFAULT_INITIAL_DELAY;
        this.stableLength = stableLength != null ? stableLength : DEFAULT_STABLE_LENGTH;
        this.multiplier = multiplier != null ? multiplier : DEFAULT_MULTIPLIER;
        this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
        this.maxCount = maxCount;
        validate();
    }

    private void validate() {
        if (initialDelay < 0) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay < initialDelay) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (stableLength < 0) {
            throw new IllegalArgumentException("stableLength must be >= 0");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxCount != null && maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be >= 1");
        }
    }

    @Override
    public String name() {
        return "progressive";
    }

    @Override
    public Delay delay(int attempt) {
        if (maxCount != null && attempt > maxCount) {
            return Delay.STOP;
        }
        if (attempt <= stableLength) {
            return Delay.ofMillis(initialDelay);
        }
        // 倍数先取整再相乘; 超大倍数直接落到 maxDelay
        long factor = (long) Math.pow(multiplier, attempt - stableLength);
        if (initialDelay != 0 && factor > maxDelay / initialDelay) {
            return Delay.ofMillis(maxDelay);
        }
        return Delay.ofMillis(Math.min(maxDelay, initialDelay * factor));
    }

    @Override
    public String toString() {
        return "progressive(initialDelay=" + initialDelay + ", stableLength=" + stableLength
                + ", multiplier=" + multiplier + ", maxDelay=" + maxDelay
                + (maxCount == null ? "" : ", maxCount=" + maxCount) + ")";
    }
}
