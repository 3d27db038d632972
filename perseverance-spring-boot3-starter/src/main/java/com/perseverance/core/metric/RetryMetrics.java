package com.perseverance.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final MeterRegistry registry;
    private final Counter retried;
    private final Counter exhausted;
    private final Timer backoffTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.registry  = reg;
        this.retried   = Counter.builder("perseverance.retry").description("retries scheduled").register(reg);
        this.exhausted = Counter.builder("perseverance.exhausted").description("retries given up by strategy").register(reg);
        this.backoffTimer = Timer.builder("perseverance.backoff").description("scheduled backoff delay").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /**
     * 单个业务注册表直接使用; 多个时合并; 没有时落到 Simple
     */
    public static RetryMetrics create(List<MeterRegistry> discovered) {
        if (discovered == null || discovered.isEmpty()) {
            return new RetryMetrics(new SimpleMeterRegistry());
        }
        if (discovered.size() == 1) {
            return new RetryMetrics(discovered.get(0));
        }
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        discovered.forEach(composite::add);
        return new RetryMetrics(composite);
    }

    public MeterRegistry getRegistry() { return registry; }

    public void incRetried(){   retried.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void recordBackoffMillis(long millis){ backoffTimer.record(millis, TimeUnit.MILLISECONDS); }
}
