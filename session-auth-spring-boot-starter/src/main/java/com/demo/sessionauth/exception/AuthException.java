package com.demo.sessionauth.exception;

import java.util.Objects;

/**
 * 认证模块异常基类，携带 {@link AuthErrorCode} 以便统一渲染为错误响应。
 */
public class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public AuthException(AuthErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
