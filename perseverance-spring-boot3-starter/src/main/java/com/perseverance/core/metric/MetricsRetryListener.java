package com.perseverance.core.metric;

import com.perseverance.core.spi.RetryListener;

import java.util.Objects;

public class MetricsRetryListener implements RetryListener {

    private final RetryMetrics metrics;

    public MetricsRetryListener(RetryMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onRetry(RuntimeException failure, int attempt, long delayMillis) {
        metrics.incRetried();
        metrics.recordBackoffMillis(delayMillis);
    }

    @Override
    public void onExhausted(RuntimeException failure, int attempt) {
        metrics.incExhausted();
    }
}
