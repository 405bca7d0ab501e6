package com.demo.sessionauth.web;

import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.web.response.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.Objects;

/**
 * 把控制器/切面抛出的 {@link AuthException} 渲染为 {@link ApiError}。
 * <p>
 * 500 类错误不回显内部异常信息。
 */
@RestControllerAdvice
public class AuthExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AuthExceptionHandler.class);

    private final Clock clock;

    public AuthExceptionHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ApiError> handleAuth(AuthException ex) {
        AuthErrorCode code = ex.getErrorCode();
        String message = ex.getMessage();
        if (code.getHttpStatus() >= 500) {
            log.error("Authentication failure", ex);
            message = code.getDefaultMessage();
        } else {
            log.debug("Auth rejected: code={}, message={}", code, message);
        }
        return ResponseEntity.status(code.getHttpStatus()).body(ApiError.of(code, message, clock));
    }
}
