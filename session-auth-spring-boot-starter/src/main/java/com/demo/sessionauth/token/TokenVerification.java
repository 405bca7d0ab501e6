package com.demo.sessionauth.token;

/**
 * token 校验结果：要么携带声明，要么携带失败原因。预期内的失败不抛异常。
 */
public record TokenVerification<T>(boolean valid, T claims, TokenFailure failure, String reason) {

    public static <T> TokenVerification<T> valid(T claims) {
        return new TokenVerification<>(true, claims, null, null);
    }

    public static <T> TokenVerification<T> invalid(TokenFailure failure, String reason) {
        return new TokenVerification<>(false, null, failure, reason);
    }
}
