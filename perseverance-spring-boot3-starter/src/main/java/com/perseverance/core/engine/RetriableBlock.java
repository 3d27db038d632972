package com.perseverance.core.engine;

import com.perseverance.core.context.RetryContext;
import com.perseverance.core.context.RetryContextHolder;
import com.perseverance.core.context.RetryContextStack;
import com.perseverance.core.spi.RetriableCallable;
import com.perseverance.core.spi.RetriableRunnable;
import com.perseverance.model.Delay;
import com.perseverance.model.ErrorToken;
import com.perseverance.model.RetriableOptions;
import com.perseverance.model.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 调用方: 把一段代码标记为可重试, 但不决定重试策略
 *
 * 每次执行:
 * 1. 生成新的 ErrorToken
 * 2. 失败类型命中 catchKinds 时包装失败, 从当前线程的上下文栈自顶向下找接手的上下文
 * 3. 无上下文接手 -> 抛原始失败; 策略 STOP -> 抛包装后的失败; 否则回调监听器, 等待, 重试
 * 未命中 catchKinds 的失败原样抛出
 */
public final class RetriableBlock {

    private static final Logger log = LoggerFactory.getLogger(RetriableBlock.class);

    private final RetriableOptions options;

    public RetriableBlock(RetriableOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public <T> T execute(RetriableCallable<T> body) throws Exception {
        Objects.requireNonNull(body, "body");
        ErrorToken token = ErrorToken.next();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return body.call();
                } catch (Exception e) {
                    if (!options.catches(e)) {
                        throw e;
                    }
                    RetryDecision decision = decide(e, attempt, token);
                    switch (decision.getOutcome()) {
                        case UNHANDLED -> throw e;
                        case EXHAUSTED -> {
                            decision.getContext().getListener().onExhausted(decision.getFailure(), attempt);
                            throw decision.getFailure();
                        }
                        default -> backoff(decision, attempt);
                    }
                }
            }
        } finally {
            RetryContextHolder.current().forget(token);
        }
    }

    public void run(RetriableRunnable body) throws Exception {
        Objects.requireNonNull(body, "body");
        execute(() -> {
            body.run();
            return null;
        });
    }

    /**
     * 找到接手的上下文并向其策略要延迟
     */
    RetryDecision decide(Exception original, int attempt, ErrorToken token) {
        RuntimeException wrapped = options.wrap(original, token);
        RetryContextStack stack = RetryContextHolder.current();
        RetryContext ctx = stack.find(wrapped);
        if (ctx == null) {
            log.debug("[Retriable] no retry context accepts {}, rethrowing (contexts={})", original, stack.size());
            return RetryDecision.unhandled();
        }
        Delay delay = ctx.strategyFor(token).delay(attempt);
        if (delay.isStop()) {
            log.debug("[Retriable] strategy gave up after attempt {} for {}", attempt, token);
            return RetryDecision.exhausted(ctx, wrapped);
        }
        return RetryDecision.retry(ctx, delay, wrapped);
    }

    private void backoff(RetryDecision decision, int attempt) throws InterruptedException {
        RetryContext ctx = decision.getContext();
        long millis = decision.getDelay().toMillis();
        ctx.getListener().onRetry(decision.getFailure(), attempt, millis);
        ctx.getSleeper().sleep(millis);
    }
}
