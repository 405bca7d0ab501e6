package com.demo.sessionauth.store;

/**
 * 日志里只输出 token 前 20 个字符。
 */
public final class TokenPreview {

    private static final int LENGTH = 20;

    private TokenPreview() {
    }

    public static String of(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= LENGTH ? token : token.substring(0, LENGTH) + "...";
    }
}
