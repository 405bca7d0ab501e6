package com.demo.sessionauth.exception;

/**
 * Refresh Token 已签名但持久化失败。此时不返回 token（要么全成功，要么全失败）。
 */
public class RefreshTokenCreationException extends TokenCreationException {

    public RefreshTokenCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
