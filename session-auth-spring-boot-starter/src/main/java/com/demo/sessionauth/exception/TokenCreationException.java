package com.demo.sessionauth.exception;

/**
 * 签发 token 失败（签名异常等）。不做重试，直接抛给调用方。
 */
public class TokenCreationException extends AuthException {

    public TokenCreationException(String message) {
        super(AuthErrorCode.AUTHENTICATION_FAILED, message);
    }

    public TokenCreationException(String message, Throwable cause) {
        super(AuthErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
