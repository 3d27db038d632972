package com.perseverance.core.context;

import com.perseverance.core.spi.RetriableCallable;

import java.util.Objects;

/**
 * 当前线程的上下文栈
 * 非 InheritableThreadLocal: 一个线程建立的上下文对其他线程不可见
 */
public final class RetryContextHolder {

    private static final ThreadLocal<RetryContextStack> CURRENT =
            ThreadLocal.withInitial(() -> RetryContextStack.EMPTY);

    private RetryContextHolder() {
    }

    public static RetryContextStack current() {
        return CURRENT.get();
    }

    /**
     * 将 ctx 压栈后执行 body, 无论 body 如何退出都恢复进入前的栈
     */
    public static <T> T callWithin(RetryContext ctx, RetriableCallable<T> body) throws Exception {
        Objects.requireNonNull(body, "body");
        RetryContextStack prior = CURRENT.get();
        CURRENT.set(prior.push(ctx));
        try {
            return body.call();
        } finally {
            restore(prior);
        }
    }

    private static void restore(RetryContextStack prior) {
        if (prior.isEmpty()) {
            CURRENT.remove();
        } else {
            CURRENT.set(prior);
        }
    }
}
