package com.perseverance.core.listener;

import com.perseverance.core.spi.RetryListener;

import java.util.List;

/**
 * 按顺序分发, 任一监听器抛出的异常直接向上传播
 */
public class CompositeRetryListener implements RetryListener {

    private final List<RetryListener> delegates;

    public CompositeRetryListener(List<RetryListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static RetryListener of(RetryListener... listeners) {
        return listeners.length == 1 ? listeners[0] : new CompositeRetryListener(List.of(listeners));
    }

    @Override
    public void onRetry(RuntimeException failure, int attempt, long delayMillis) {
        for (RetryListener l : delegates) {
            l.onRetry(failure, attempt, delayMillis);
        }
    }

    @Override
    public void onExhausted(RuntimeException failure, int attempt) {
        for (RetryListener l : delegates) {
            l.onExhausted(failure, attempt);
        }
    }

    public List<RetryListener> getDelegates() { return delegates; }
}
