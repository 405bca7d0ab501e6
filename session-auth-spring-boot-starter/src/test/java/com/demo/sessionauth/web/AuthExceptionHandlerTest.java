package com.demo.sessionauth.web;

import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.support.MutableClock;
import com.demo.sessionauth.web.response.ApiError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthExceptionHandler 测试")
class AuthExceptionHandlerTest {

    private final AuthExceptionHandler handler =
            new AuthExceptionHandler(MutableClock.startingAt("2024-05-01T10:00:00Z"));

    @Test
    @DisplayName("403：状态码与错误体一致")
    void forbidden() {
        ResponseEntity<ApiError> response = handler.handleAuth(new AuthException(AuthErrorCode.INSUFFICIENT_ROLE));

        assertThat(response.getStatusCode().value()).isEqualTo(403);
        assertThat(response.getBody()).isEqualTo(
                new ApiError("INSUFFICIENT_ROLE", "Insufficient roles", 403, "2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("401：保留自定义信息")
    void customMessageKept() {
        ResponseEntity<ApiError> response = handler.handleAuth(
                new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Bad username or password"));

        assertThat(response.getStatusCode().value()).isEqualTo(401);
        assertThat(response.getBody().message()).isEqualTo("Bad username or password");
    }

    @Test
    @DisplayName("500：不回显内部信息")
    void serverErrorHidesDetails() {
        ResponseEntity<ApiError> response = handler.handleAuth(new AuthException(
                AuthErrorCode.AUTHENTICATION_FAILED, "redis://10.0.0.5 refused", new IllegalStateException()));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).isEqualTo("Authentication failed");
    }
}
