package com.perseverance.model;

import com.perseverance.core.context.RetryContext;
import lombok.Getter;

/**
 * 上下文对一次失败给出的决策
 */
@Getter
public final class RetryDecision {

    private static final RetryDecision UNHANDLED = new RetryDecision(Outcome.UNHANDLED, null, null, null);

    private final Outcome outcome;
    /** 仅 RETRY */
    private final Delay delay;
    /** RETRY / EXHAUSTED 时为包装后的失败 */
    private final RuntimeException failure;
    /** 接手的上下文, UNHANDLED 时为 null */
    private final RetryContext context;

    private RetryDecision(Outcome outcome, Delay delay, RuntimeException failure, RetryContext context) {
        this.outcome = outcome;
        this.delay = delay;
        this.failure = failure;
        this.context = context;
    }

    public static RetryDecision retry(RetryContext ctx, Delay delay, RuntimeException wrapped) {
        return new RetryDecision(Outcome.RETRY, delay, wrapped, ctx);
    }

    public static RetryDecision exhausted(RetryContext ctx, RuntimeException wrapped) {
        return new RetryDecision(Outcome.EXHAUSTED, Delay.STOP, wrapped, ctx);
    }

    public static RetryDecision unhandled() { return UNHANDLED; }

    public enum Outcome {
        /** 等待后重试 */
        RETRY,
        /** 策略返回 STOP, 抛出包装后的失败 */
        EXHAUSTED,
        /** 没有上下文接手, 抛出原始失败 */
        UNHANDLED
    }
}
