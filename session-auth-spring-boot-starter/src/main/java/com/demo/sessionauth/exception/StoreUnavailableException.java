package com.demo.sessionauth.exception;

/**
 * 缓存后端不可用（连接失败、命令超时等）。属于瞬时的基础设施故障。
 */
public class StoreUnavailableException extends AuthException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(AuthErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
