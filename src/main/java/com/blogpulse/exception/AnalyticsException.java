package com.blogpulse.exception;

import lombok.Getter;

/**
 * 分析引擎内部异常：由存储层抛出，在服务边界统一捕获并记录，不向调用方传播。
 */
@Getter
public class AnalyticsException extends RuntimeException {

    private final ErrorCode errorCode;

    public AnalyticsException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public AnalyticsException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalyticsException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
