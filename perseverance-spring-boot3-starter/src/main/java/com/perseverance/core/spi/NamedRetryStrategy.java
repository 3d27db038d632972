package com.perseverance.core.spi;

/**
 * 可按名称注册到 StrategyRegistry 的策略（配置中以 "spi:{name}" 引用）
 */
public interface NamedRetryStrategy extends RetryStrategy {

    /** 策略唯一名称 */
    String name();
}
