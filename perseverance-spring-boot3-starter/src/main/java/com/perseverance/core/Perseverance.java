package com.perseverance.core;

import com.perseverance.core.engine.RetriableBlock;
import com.perseverance.core.engine.RetryScope;
import com.perseverance.core.spi.RetriableCallable;
import com.perseverance.model.RetriableOptions;
import com.perseverance.model.RetryOptions;

/**
 * 静态入口
 *
 * <pre>
 * // 底层代码: 声明 IOException 可重试
 * byte[] data = Perseverance.retriable(RetriableOptions.builder().tag("download").build(), () -> fetch(url));
 *
 * // 上层代码: 决定策略
 * Perseverance.retry(RetryOptions.builder()
 *         .strategy(new ConstantRetryStrategy(1000, 5))
 *         .selectTag("download")
 *         .build(), () -> sync());
 * </pre>
 */
public final class Perseverance {

    private Perseverance() {
    }

    public static <T> T retriable(RetriableOptions options, RetriableCallable<T> body) throws Exception {
        return new RetriableBlock(options).execute(body);
    }

    /** 使用默认配置（只拦截 IOException, 无 tag） */
    public static <T> T retriable(RetriableCallable<T> body) throws Exception {
        return retriable(RetriableOptions.defaults(), body);
    }

    public static <T> T retry(RetryOptions options, RetriableCallable<T> body) throws Exception {
        return new RetryScope(options).execute(body);
    }

    public static <T> T retry(RetriableCallable<T> body) throws Exception {
        return retry(RetryOptions.defaults(), body);
    }
}
