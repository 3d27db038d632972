package com.perseverance.core.listener;

import com.perseverance.core.spi.RetryListener;

import java.io.PrintStream;
import java.util.Objects;

/**
 * 输出到 stdout, 未配置监听器时的默认实现
 */
public class ConsoleRetryListener implements RetryListener {

    private final PrintStream out;

    public ConsoleRetryListener() {
        this(System.out);
    }

    public ConsoleRetryListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onRetry(RuntimeException failure, int attempt, long delayMillis) {
        out.println(RetryMessages.retrying(failure, delayMillis));
    }
}
