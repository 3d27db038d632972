package com.perseverance.core.context;

import com.perseverance.exception.RetriableException;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 常用的上下文选择器
 */
public final class Selectors {

    private Selectors() {
    }

    /**
     * 匹配 tag 相同的默认包装; 自定义包装不会被匹配
     */
    public static Predicate<RuntimeException> tag(String tag) {
        Objects.requireNonNull(tag, "tag");
        return wrapped -> wrapped instanceof RetriableException
                && tag.equals(((RetriableException) wrapped).getTag());
    }

    /**
     * 匹配原始失败为指定类型（或子类）的默认包装
     */
    public static Predicate<RuntimeException> causedBy(Class<? extends Exception> kind) {
        Objects.requireNonNull(kind, "kind");
        return wrapped -> wrapped instanceof RetriableException && kind.isInstance(wrapped.getCause());
    }
}
