package com.perseverance.core.spi;

@FunctionalInterface
public interface RetriableRunnable {

    void run() throws Exception;
}
