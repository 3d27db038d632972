package com.perseverance.core.engine;

import com.perseverance.core.backoff.ProgressiveRetryStrategy;
import com.perseverance.core.context.RetryContext;
import com.perseverance.core.context.RetryContextHolder;
import com.perseverance.core.listener.ConsoleRetryListener;
import com.perseverance.core.spi.RetriableCallable;
import com.perseverance.core.spi.RetriableRunnable;
import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.core.spi.Sleeper;
import com.perseverance.model.RetryOptions;

import java.util.Objects;

/**
 * 处理方: 在 body 的动态范围内建立重试上下文, 决定是否重试、间隔多久
 * 每次 execute 创建独立的上下文, 退出时恢复进入前的上下文栈
 */
public final class RetryScope {

    private final RetryOptions options;

    private final RetryOptions fallback;

    public RetryScope(RetryOptions options) {
        this(options, RetryOptions.defaults());
    }

    /**
     * @param fallback options 中未设置的项从这里取, 仍未设置则用内置默认
     */
    public RetryScope(RetryOptions options, RetryOptions fallback) {
        this.options = Objects.requireNonNull(options, "options");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public <T> T execute(RetriableCallable<T> body) throws Exception {
        return RetryContextHolder.callWithin(newContext(), body);
    }

    public void run(RetriableRunnable body) throws Exception {
        Objects.requireNonNull(body, "body");
        execute(() -> {
            body.run();
            return null;
        });
    }

    RetryContext newContext() {
        RetryStrategy strategy = firstNonNull(options.getStrategy(), fallback.getStrategy());
        RetryListener listener = firstNonNull(options.getListener(), fallback.getListener());
        Sleeper sleeper = firstNonNull(options.getSleeper(), fallback.getSleeper());
        return new RetryContext(
                strategy != null ? strategy : new ProgressiveRetryStrategy(),
                firstNonNull(options.getSelector(), fallback.getSelector()),
                listener != null ? listener : new ConsoleRetryListener(),
                sleeper != null ? sleeper : Sleeper.THREAD);
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
