package com.demo.sessionauth.exception;

/**
 * 认证/授权失败原因。
 * <p>
 * 每个错误码固定对应一个 HTTP 状态（401 / 403 / 500），用于拼装统一的错误响应体。
 */
public enum AuthErrorCode {

    NO_TOKEN(401, "No token provided"),
    TOKEN_INVALID(401, "Invalid token"),
    TOKEN_EXPIRED(401, "Token expired"),
    TOKEN_BLACKLISTED(401, "Token is blacklisted"),
    WRONG_TOKEN_TYPE(401, "Invalid token type"),
    SESSION_MISSING(401, "Session not found"),
    SESSION_EXPIRED(401, "Session expired"),
    SESSION_UNAVAILABLE(401, "Session could not be verified"),
    AUTHENTICATION_REQUIRED(401, "Authentication required"),
    INVALID_CREDENTIALS(401, "Invalid credentials"),
    REFRESH_TOKEN_INVALID(401, "Invalid refresh token"),
    RESET_TOKEN_INVALID(401, "Invalid or expired reset token"),
    RESET_TOKEN_USED(401, "Reset token has already been used"),

    INSUFFICIENT_ROLE(403, "Insufficient roles"),
    INSUFFICIENT_PERMISSION(403, "Insufficient permissions"),
    ACCESS_DENIED(403, "Access denied"),
    DEVICE_NOT_VERIFIED(403, "Device verification required"),
    IP_NOT_ALLOWED(403, "IP not whitelisted"),

    AUTHENTICATION_FAILED(500, "Authentication failed");

    private final int httpStatus;
    private final String defaultMessage;

    AuthErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
