package com.demo.sessionauth.token;

/**
 * 刷新或登录后返回的 access/refresh token 组合。
 * <p>
 * 未开启轮换时 refreshToken 与请求中提交的一致。
 */
public record TokenPair(String accessToken, String refreshToken) {
}
