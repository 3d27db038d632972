package com.perseverance.core.listener;

import com.perseverance.exception.RetriableException;

import java.util.Locale;

/**
 * 重试日志文案: "<failure>, retrying in <seconds> seconds..."
 */
public final class RetryMessages {

    private RetryMessages() {
    }

    public static String retrying(RuntimeException failure, long delayMillis) {
        return String.format(Locale.ROOT, "%s, retrying in %.1f seconds...",
                describe(failure), delayMillis / 1000.0);
    }

    /**
     * 默认包装取原始失败, 自定义包装取其自身
     */
    public static String describe(RuntimeException failure) {
        if (failure instanceof RetriableException && failure.getCause() != null) {
            return String.valueOf(failure.getCause());
        }
        return String.valueOf(failure);
    }
}
