package com.perseverance.autoconfig;

import com.perseverance.config.PerseveranceProperties;
import com.perseverance.core.RetryScopeTemplate;
import com.perseverance.core.backoff.StrategyRegistry;
import com.perseverance.core.listener.CompositeRetryListener;
import com.perseverance.core.listener.ConsoleRetryListener;
import com.perseverance.core.listener.LoggingRetryListener;
import com.perseverance.core.metric.MetricsRetryListener;
import com.perseverance.core.metric.RetryMetrics;
import com.perseverance.core.spi.NamedRetryStrategy;
import com.perseverance.core.spi.RetryListener;
import com.perseverance.core.spi.RetryStrategy;
import com.perseverance.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.stream.Collectors;

/**
 * 策略注册中心、默认监听器及 RetryScopeTemplate
 */
@AutoConfiguration(after = PerseveranceMetricsAutoConfiguration.class)
@EnableConfigurationProperties(PerseveranceProperties.class)
public class PerseveranceAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PerseveranceAutoConfiguration.class);

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public StrategyRegistry strategyRegistry(PerseveranceProperties props,
                                             ObjectProvider<NamedRetryStrategy> discovered) {
        return new StrategyRegistry(props, discovered.orderedStream().collect(Collectors.toList()));
    }

    /**
     * 默认监听器
     */
    @Bean
    @ConditionalOnMissingBean(RetryListener.class)
    public RetryListener perseveranceRetryListener(PerseveranceProperties props) {
        return switch (props.getLog().getStyle()) {
            case STDOUT -> new ConsoleRetryListener();
            default -> new LoggingRetryListener();
        };
    }

    /**
     * 默认策略, 由 perseverance.strategy 解析; 用户声明的 RetryStrategy bean 优先
     * NamedRetryStrategy 只是注册到 StrategyRegistry 的候选, 不替换默认策略
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(value = RetryStrategy.class, ignored = NamedRetryStrategy.class)
    public RetryStrategy perseveranceRetryStrategy(StrategyRegistry registry) {
        return registry.defaultStrategy();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper perseveranceSleeper() {
        return Sleeper.THREAD;
    }

    /**
     * 重试模板, 启用指标时附带指标监听
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryScopeTemplate retryScopeTemplate(StrategyRegistry registry,
                                                 ObjectProvider<RetryStrategy> strategies,
                                                 RetryListener listener,
                                                 Sleeper sleeper,
                                                 ObjectProvider<RetryMetrics> metrics) {
        RetryStrategy strategy = strategies.getIfUnique();
        if (strategy == null) {
            // 用户策略与 NamedRetryStrategy 并存: 取第一个非具名策略
            strategy = strategies.orderedStream()
                    .filter(s -> !(s instanceof NamedRetryStrategy))
                    .findFirst()
                    .orElseGet(registry::defaultStrategy);
        }
        RetryMetrics m = metrics.getIfAvailable();
        RetryListener effective = m == null ? listener
                : CompositeRetryListener.of(listener, new MetricsRetryListener(m));
        log.info("[Perseverance] default strategy={}, metrics={}", strategy, m != null);
        return new RetryScopeTemplate(strategy, effective, sleeper);
    }
}
