package com.perseverance.model;

import com.perseverance.core.context.Selectors;
import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.core.spi.Sleeper;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Predicate;

/**
 * retry scope 的配置, 未设置的项使用默认值:
 * strategy = ProgressiveRetryStrategy(), selector = 全部匹配, listener = 输出到 stdout, sleeper = Thread.sleep
 */
@Getter
@Builder(toBuilder = true)
public class RetryOptions {

    private RetryStrategy strategy;

    private Predicate<RuntimeException> selector;

    private RetryListener listener;

    private Sleeper sleeper;

    public static RetryOptions defaults() {
        return builder().build();
    }

    public static class RetryOptionsBuilder {

        /** 只处理带该 tag 的失败 */
        public RetryOptionsBuilder selectTag(String tag) {
            return selector(Selectors.tag(tag));
        }
    }
}
