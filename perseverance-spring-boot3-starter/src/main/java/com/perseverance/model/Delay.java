package com.perseverance.model;

import lombok.EqualsAndHashCode;

/**
 * 退避延迟（毫秒）或 STOP（不再重试）
 */
@EqualsAndHashCode
public final class Delay {

    public static final Delay STOP = new Delay(-1L);

    private final long millis;

    private Delay(long millis) {
        this.millis = millis;
    }

    public static Delay ofMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("delay must be >= 0, got " + millis);
        }
        return new Delay(millis);
    }

    public boolean isStop() { return this == STOP; }

    /** STOP 调用抛 IllegalStateException */
    public long toMillis() {
        if (isStop()) {
            throw new IllegalStateException("STOP carries no delay");
        }
        return millis;
    }

    @Override
    public String toString() {
        return isStop() ? "STOP" : millis + "ms";
    }
}
