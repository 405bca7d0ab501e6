package com.demo.sessionauth.web.response;

import com.demo.sessionauth.exception.AuthErrorCode;

import java.time.Clock;

/**
 * 统一错误响应体：{"error","message","statusCode","timestamp"}。
 *
 * @param error     错误码名称，如 TOKEN_EXPIRED
 * @param timestamp ISO-8601
 */
public record ApiError(String error, String message, int statusCode, String timestamp) {

    public static ApiError of(AuthErrorCode code, String message, Clock clock) {
        return new ApiError(
                code.name(),
                message == null ? code.getDefaultMessage() : message,
                code.getHttpStatus(),
                clock.instant().toString()
        );
    }
}
