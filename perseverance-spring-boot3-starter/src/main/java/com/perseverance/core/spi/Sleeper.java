package com.perseverance.core.spi;

/**
 * 重试前的阻塞等待
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
