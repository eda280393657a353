package com.blogpulse.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "存储集群不可用"),
    STORE_COMMAND_FAILED("STORE_COMMAND_FAILED", "存储命令执行失败"),
    WRONG_TYPE("WRONG_TYPE", "键类型与操作不匹配"),
    SERIALIZATION_FAILED("SERIALIZATION_FAILED", "序列化失败");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
