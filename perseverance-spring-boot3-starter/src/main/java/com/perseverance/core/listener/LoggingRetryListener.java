package com.perseverance.core.listener;

import com.perseverance.core.spi.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, Spring 环境下默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public void onRetry(RuntimeException failure, int attempt, long delayMillis) {
        if (log.isWarnEnabled()) {
            log.warn("[Retry-{}] {}", attempt, RetryMessages.retrying(failure, delayMillis));
        }
    }

    @Override
    public void onExhausted(RuntimeException failure, int attempt) {
        log.error("[Retry-{}] giving up: {}", attempt, RetryMessages.describe(failure));
    }
}
