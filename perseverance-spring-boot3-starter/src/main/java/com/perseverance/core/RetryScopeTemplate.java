package com.perseverance.core;

import com.perseverance.core.engine.RetryScope;
import com.perseverance.core.spi.RetriableCallable;
import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.core.spi.Sleeper;
import com.perseverance.model.RetryOptions;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 带默认策略/监听器/sleeper 的 retry scope 工厂, 可作为单例 bean 共享
 * 每次调用都新建上下文, 模板本身不持有可变状态
 */
public class RetryScopeTemplate {

    /** 默认配置, selector 恒为 null */
    private final RetryOptions defaults;

    public RetryScopeTemplate(RetryStrategy strategy, RetryListener listener, Sleeper sleeper) {
        this.defaults = RetryOptions.builder()
                .strategy(Objects.requireNonNull(strategy, "strategy"))
                .listener(Objects.requireNonNull(listener, "listener"))
                .sleeper(Objects.requireNonNull(sleeper, "sleeper"))
                .build();
    }

    /** 无条件接手 */
    public <T> T retry(RetriableCallable<T> body) throws Exception {
        return retry(RetryOptions.defaults(), body);
    }

    /** 只接手带该 tag 的失败 */
    public <T> T retry(String tag, RetriableCallable<T> body) throws Exception {
        return retry(RetryOptions.builder().selectTag(tag).build(), body);
    }

    public <T> T retry(Predicate<RuntimeException> selector, RetriableCallable<T> body) throws Exception {
        return retry(RetryOptions.builder().selector(selector).build(), body);
    }

    /**
     * options 中未设置的项回落到模板默认值
     */
    public <T> T retry(RetryOptions options, RetriableCallable<T> body) throws Exception {
        return new RetryScope(options, defaults).execute(body);
    }

    public RetryStrategy getDefaultStrategy() { return defaults.getStrategy(); }

    public RetryListener getDefaultListener() { return defaults.getListener(); }
}
