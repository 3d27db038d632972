package com.perseverance.core.context;

import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.core.spi.Sleeper;
import com.perseverance.model.ErrorToken;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 重试上下文, 由 retry scope 创建, 只在该 scope 的动态范围内有效
 * 不跨线程共享, 因此 token -> 策略 的缓存不加锁
 */
public final class RetryContext {

    @Getter
    private final RetryStrategy strategy;

    /** null 表示无条件匹配 */
    private final Predicate<RuntimeException> selector;

    @Getter
    private final RetryListener listener;

    @Getter
    private final Sleeper sleeper;

    private final Map<ErrorToken, RetryStrategy> strategies = new HashMap<>();

    public RetryContext(RetryStrategy strategy, Predicate<RuntimeException> selector,
                        RetryListener listener, Sleeper sleeper) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.selector = selector;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public boolean matches(RuntimeException wrapped) {
        return selector == null || selector.test(wrapped);
    }

    /**
     * 取该 token 的策略状态, 首次访问时创建
     */
    public RetryStrategy strategyFor(ErrorToken token) {
        return strategies.computeIfAbsent(token, t -> strategy.fork());
    }

    void forget(ErrorToken token) {
        strategies.remove(token);
    }

    int trackedTokens() {
        return strategies.size();
    }

    @Override
    public String toString() {
        return "RetryContext{strategy=" + strategy + ", selective=" + (selector != null) + "}";
    }
}
