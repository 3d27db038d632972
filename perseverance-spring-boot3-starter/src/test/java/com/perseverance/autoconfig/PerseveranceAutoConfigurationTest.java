package com.perseverance.autoconfig;

import com.perseverance.core.Perseverance;
import com.perseverance.core.RetryScopeTemplate;
import com.perseverance.core.backoff.StrategyRegistry;
import com.perseverance.core.listener.CompositeRetryListener;
import com.perseverance.core.listener.ConsoleRetryListener;
import com.perseverance.core.listener.LoggingRetryListener;
import com.perseverance.core.metric.RetryMetrics;
import com.perseverance.core.spi.NamedRetryStrategy;
import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.exception.RetriableException;
import com.perseverance.core.spi.Sleeper;
import com.perseverance.model.Delay;
import com.perseverance.support.RecordingSleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PerseveranceAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    PerseveranceMetricsAutoConfiguration.class,
                    PerseveranceAutoConfiguration.class));

    @Test
    void defaultsToProgressiveWithLoggingAndMetrics() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            RetryScopeTemplate template = ctx.getBean(RetryScopeTemplate.class);
            assertEquals(500, template.getDefaultStrategy().delay(1).toMillis());
            assertEquals(1000, template.getDefaultStrategy().delay(4).toMillis());
            assertTrue(ctx.getBean(RetryListener.class) instanceof LoggingRetryListener);
            assertTrue(template.getDefaultListener() instanceof CompositeRetryListener);
            assertNotNull(ctx.getBean(RetryMetrics.class));
        });
    }

    @Test
    void bindsConstantStrategyFromProperties() {
        runner.withPropertyValues(
                        "perseverance.strategy=constant",
                        "perseverance.constant.delay=250ms",
                        "perseverance.constant.max-count=2",
                        "perseverance.log.style=STDOUT",
                        "perseverance.metrics.enabled=false")
                .run(ctx -> {
                    RetryScopeTemplate template = ctx.getBean(RetryScopeTemplate.class);
                    assertEquals(Delay.ofMillis(250), template.getDefaultStrategy().delay(2));
                    assertTrue(template.getDefaultStrategy().delay(3).isStop());
                    assertTrue(template.getDefaultListener() instanceof ConsoleRetryListener);
                    assertTrue(ctx.getBeansOfType(RetryMetrics.class).isEmpty());
                });
    }

    @Test
    void resolvesUserStrategyBySpiName() {
        runner.withPropertyValues("perseverance.strategy=spi:tiny")
                .withBean("tinyStrategy", NamedRetryStrategy.class, () -> new NamedRetryStrategy() {
                    @Override
                    public String name() {
                        return "tiny";
                    }

                    @Override
                    public Delay delay(int attempt) {
                        return attempt > 1 ? Delay.STOP : Delay.ofMillis(3);
                    }
                })
                .run(ctx -> {
                    assertEquals(3, ctx.getBean(RetryScopeTemplate.class).getDefaultStrategy().delay(1).toMillis());
                    assertTrue(ctx.getBean(StrategyRegistry.class).names().contains("tiny"));
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        runner.withPropertyValues(
                        "perseverance.progressive.initial-delay=10s",
                        "perseverance.progressive.max-delay=1s")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void templateRetriesAndRecordsMetrics() {
        RecordingSleeper sleeper = new RecordingSleeper();
        runner.withPropertyValues("perseverance.strategy=constant", "perseverance.constant.delay=40ms")
                .withBean(Sleeper.class, () -> sleeper)
                .run(ctx -> {
                    RetryScopeTemplate template = ctx.getBean(RetryScopeTemplate.class);
                    AtomicInteger calls = new AtomicInteger();

                    Object result = template.retry(() -> Perseverance.retriable(() -> {
                        if (calls.incrementAndGet() < 3) {
                            throw new IOException("flaky");
                        }
                        return "ok";
                    }));

                    assertEquals("ok", result);
                    assertEquals(2, sleeper.getSleeps().size());
                    MeterRegistry registry = ctx.getBean(RetryMetrics.class).getRegistry();
                    assertEquals(2.0, registry.get("perseverance.retry").counter().count());
                    assertEquals(2L, registry.get("perseverance.backoff").timer().count());
                });
    }

    @Test
    void publishesDefaultStrategyBean() {
        runner.run(ctx -> {
            RetryStrategy strategy = ctx.getBean(RetryStrategy.class);
            assertSame(ctx.getBean(StrategyRegistry.class).defaultStrategy(), strategy);
            assertSame(strategy, ctx.getBean(RetryScopeTemplate.class).getDefaultStrategy());
        });
    }

    @Test
    void userStrategyBeanBecomesTemplateDefault() {
        RetryStrategy mine = attempt -> Delay.ofMillis(77);
        runner.withBean(RetryStrategy.class, () -> mine)
                .run(ctx -> {
                    assertEquals(1, ctx.getBeansOfType(RetryStrategy.class).size());
                    assertSame(mine, ctx.getBean(RetryScopeTemplate.class).getDefaultStrategy());
                });
    }

    @Test
    void userStrategyWinsOverNamedCandidates() {
        RetryStrategy mine = attempt -> Delay.ofMillis(77);
        runner.withBean("mine", RetryStrategy.class, () -> mine)
                .withBean("tinyStrategy", NamedRetryStrategy.class, () -> new NamedRetryStrategy() {
                    @Override
                    public String name() {
                        return "tiny";
                    }

                    @Override
                    public Delay delay(int attempt) {
                        return Delay.ofMillis(3);
                    }
                })
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertSame(mine, ctx.getBean(RetryScopeTemplate.class).getDefaultStrategy());
                    assertTrue(ctx.getBean(StrategyRegistry.class).names().contains("tiny"));
                });
    }

    @Test
    void exhaustionIsCounted() {
        RecordingSleeper sleeper = new RecordingSleeper();
        runner.withPropertyValues(
                        "perseverance.strategy=constant",
                        "perseverance.constant.delay=10ms",
                        "perseverance.constant.max-count=1")
                .withBean(Sleeper.class, () -> sleeper)
                .run(ctx -> {
                    RetryScopeTemplate template = ctx.getBean(RetryScopeTemplate.class);
                    AtomicInteger calls = new AtomicInteger();

                    assertThrows(RetriableException.class, () -> template.retry(() -> Perseverance.retriable(() -> {
                        calls.incrementAndGet();
                        throw new IOException("down");
                    })));

                    assertEquals(2, calls.get());
                    MeterRegistry registry = ctx.getBean(RetryMetrics.class).getRegistry();
                    assertEquals(1.0, registry.get("perseverance.exhausted").counter().count());
                    assertEquals(1.0, registry.get("perseverance.retry").counter().count());
                });
    }

    @Test
    void metricsUseRegistryFromContext() {
        SimpleMeterRegistry appRegistry = new SimpleMeterRegistry();
        runner.withBean(MeterRegistry.class, () -> appRegistry)
                .run(ctx -> {
                    assertSame(appRegistry, ctx.getBean(RetryMetrics.class).getRegistry());
                    assertNotNull(appRegistry.find("perseverance.exhausted").counter());
                });
    }
}
