package com.demo.sessionauth.exception;

/**
 * token 无法解码，或缺少必需的声明（如 exp）。
 */
public class InvalidTokenFormatException extends AuthException {

    public InvalidTokenFormatException(String message) {
        super(AuthErrorCode.TOKEN_INVALID, message);
    }
}
