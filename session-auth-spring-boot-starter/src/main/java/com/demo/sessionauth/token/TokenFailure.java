package com.demo.sessionauth.token;

import com.demo.sessionauth.exception.AuthErrorCode;

/**
 * token 校验失败原因。
 */
public enum TokenFailure {

    /**
     * 结构非法、签名不符、签发者/接收方/算法不匹配。
     */
    MALFORMED(AuthErrorCode.TOKEN_INVALID),
    EXPIRED(AuthErrorCode.TOKEN_EXPIRED),
    BLACKLISTED(AuthErrorCode.TOKEN_BLACKLISTED),
    WRONG_TYPE(AuthErrorCode.WRONG_TOKEN_TYPE),
    /**
     * refresh token 与服务端存储不一致（已轮换、已吊销或已过期清除）。
     */
    NOT_STORED(AuthErrorCode.REFRESH_TOKEN_INVALID),
    /**
     * 校验依赖的存储不可用，且策略要求失败即拒绝。
     */
    STORE_UNAVAILABLE(AuthErrorCode.TOKEN_INVALID);

    private final AuthErrorCode errorCode;

    TokenFailure(AuthErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public AuthErrorCode errorCode() {
        return errorCode;
    }
}
