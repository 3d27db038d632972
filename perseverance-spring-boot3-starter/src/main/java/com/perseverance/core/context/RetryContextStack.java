package com.perseverance.core.context;

import com.perseverance.model.ErrorToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 不可变的上下文栈, 最内层在栈顶
 * push 返回新栈, 原栈不变, 便于 scope 退出时原样恢复
 */
public final class RetryContextStack {

    public static final RetryContextStack EMPTY = new RetryContextStack(null, null, 0);

    private final RetryContext head;
    private final RetryContextStack tail;
    private final int size;

    private RetryContextStack(RetryContext head, RetryContextStack tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    public RetryContextStack push(RetryContext ctx) {
        return new RetryContextStack(Objects.requireNonNull(ctx, "ctx"), this, size + 1);
    }

    public boolean isEmpty() { return size == 0; }

    public int size() { return size; }

    /**
     * 自顶向下找第一个选择器接受该失败的上下文
     * @return 没有则为 null
     */
    public RetryContext find(RuntimeException wrapped) {
        for (RetryContextStack s = this; !s.isEmpty(); s = s.tail) {
            if (s.head.matches(wrapped)) {
                return s.head;
            }
        }
        return null;
    }

    /**
     * 循环退出后清理各上下文中该 token 的策略状态
     */
    public void forget(ErrorToken token) {
        for (RetryContextStack s = this; !s.isEmpty(); s = s.tail) {
            s.head.forget(token);
        }
    }

    /** 由内到外 */
    public List<RetryContext> toList() {
        List<RetryContext> out = new ArrayList<>(size);
        for (RetryContextStack s = this; !s.isEmpty(); s = s.tail) {
            out.add(s.head);
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "RetryContextStack" + toList();
    }
}
