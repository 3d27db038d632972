package com.perseverance.exception;

import com.perseverance.model.ErrorToken;
import lombok.Getter;

/**
 * retriable 代码失败后的默认包装
 * 选择器与监听器看到的是它; 策略放弃重试时抛出的也是它, 原始异常在 cause 中
 */
@Getter
public class RetriableException extends RuntimeException {

    private final String tag;

    private final transient ErrorToken token;

    public RetriableException(String tag, ErrorToken token, Exception cause) {
        super("Retriable code failed.", cause);
        this.tag = tag;
        this.token = token;
    }
}
