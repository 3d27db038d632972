package com.perseverance.core.backoff;

import com.perseverance.config.PerseveranceProperties;
import com.perseverance.core.spi.NamedRetryStrategy;
import com.perseverance.core.spi.RetryStrategy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心:
 * - 内置 constant / progressive, 参数来自配置
 * - 解析 "spi:{name}" 映射到外部注册的 NamedRetryStrategy
 * - 名称为空或未注册时回落到 progressive
 */
public class StrategyRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";
    private static final String FALLBACK = "progressive";

    private final Map<String, RetryStrategy> strategies = new ConcurrentHashMap<>(16);

    private final PerseveranceProperties props;

    public StrategyRegistry(PerseveranceProperties props, @Nullable List<NamedRetryStrategy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(s -> register(s.name(), s));
        }
    }

    public StrategyRegistry(PerseveranceProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public StrategyRegistry register(String name, RetryStrategy strategy) {
        strategies.put(normalize(name), Objects.requireNonNull(strategy, "strategy"));
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀
     */
    public RetryStrategy resolve(@Nullable String name) {
        RetryStrategy fallback = strategies.get(FALLBACK);
        if (fallback == null) {
            throw new IllegalStateException("registry not initialized, call afterPropertiesSet() first");
        }
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String s = name.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return strategies.getOrDefault(normalize(s), fallback);
    }

    /** 配置中 perseverance.strategy 指定的默认策略 */
    public RetryStrategy defaultStrategy() {
        return resolve(props.getStrategy());
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(strategies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        // 构造内置策略时完成参数校验, 非法配置直接启动失败
        PerseveranceProperties.Constant c = props.getConstant();
        strategies.putIfAbsent("constant",
                new ConstantRetryStrategy(millis(c.getDelay(), "perseverance.constant.delay"), c.getMaxCount()));

        PerseveranceProperties.Progressive p = props.getProgressive();
        strategies.putIfAbsent(FALLBACK, ProgressiveRetryStrategy.builder()
                .initialDelay(millis(p.getInitialDelay(), "perseverance.progressive.initial-delay"))
                .stableLength(p.getStableLength())
                .multiplier(p.getMultiplier())
                .maxDelay(millis(p.getMaxDelay(), "perseverance.progressive.max-delay"))
                .maxCount(p.getMaxCount())
                .build());
    }

    private static long millis(Duration d, String key) {
        if (d == null || d.isNegative()) {
            throw new IllegalArgumentException(key + " must be >= 0");
        }
        return d.toMillis();
    }
}
