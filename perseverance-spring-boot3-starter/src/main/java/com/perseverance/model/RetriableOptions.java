package com.perseverance.model;

import com.perseverance.exception.RetriableException;
import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * retriable 代码块的配置
 */
@Getter
@Builder
public class RetriableOptions {

    /** 会被拦截处理的失败类型（含子类）, 默认 IOException */
    @Builder.Default
    private Set<Class<? extends Exception>> catchKinds = Set.of(IOException.class);

    /** 附加在默认包装上的标签, 供 retry scope 的选择器路由 */
    private String tag;

    /** 自定义包装, 设置后忽略 tag */
    private Function<Exception, RuntimeException> exWrapper;

    public static RetriableOptions defaults() {
        return builder().build();
    }

    public boolean catches(Exception e) {
        for (Class<? extends Exception> kind : catchKinds) {
            if (kind.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    public RuntimeException wrap(Exception e, ErrorToken token) {
        if (exWrapper != null) {
            return Objects.requireNonNull(exWrapper.apply(e), "exWrapper returned null");
        }
        return new RetriableException(tag, token, e);
    }

    public static class RetriableOptionsBuilder {

        @SafeVarargs
        public final RetriableOptionsBuilder catching(Class<? extends Exception>... kinds) {
            return catchKinds(Set.copyOf(Arrays.asList(kinds)));
        }
    }
}
