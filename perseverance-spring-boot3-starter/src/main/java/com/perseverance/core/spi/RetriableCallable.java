package com.perseverance.core.spi;

/**
 * 可重复执行的代码块
 */
@FunctionalInterface
public interface RetriableCallable<T> {

    T call() throws Exception;
}
