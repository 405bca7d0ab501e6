package com.demo.sessionauth.exception;

/**
 * 签名密钥缺失或不合法。
 * <p>
 * 属于启动期配置错误：只记录、不降级，拒绝签发任何 token。
 */
public class SigningMisconfiguredException extends TokenCreationException {

    public SigningMisconfiguredException(String message) {
        super(message);
    }

    public SigningMisconfiguredException(String message, Throwable cause) {
        super(message, cause);
    }
}
