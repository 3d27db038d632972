package com.perseverance.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 一次 retriable 调用的标识
 * 进入循环时创建, 同一次调用的所有重试共享; 用作上下文中策略状态的 key
 */
@Getter
@EqualsAndHashCode
public final class ErrorToken {

    private static final AtomicLong SEQ = new AtomicLong();

    private final long id;

    private ErrorToken(long id) {
        this.id = id;
    }

    public static ErrorToken next() {
        return new ErrorToken(SEQ.incrementAndGet());
    }

    @Override
    public String toString() {
        return "ErrorToken#" + id;
    }
}
