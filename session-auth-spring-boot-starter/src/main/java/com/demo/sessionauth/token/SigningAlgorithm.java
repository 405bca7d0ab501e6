package com.demo.sessionauth.token;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

/**
 * 支持的 HMAC 签名算法，以及各自要求的最小密钥长度（字节）。
 */
public enum SigningAlgorithm {

    HS256(Jwts.SIG.HS256, 32),
    HS384(Jwts.SIG.HS384, 48),
    HS512(Jwts.SIG.HS512, 64);

    private final MacAlgorithm jwa;
    private final int minKeyBytes;

    SigningAlgorithm(MacAlgorithm jwa, int minKeyBytes) {
        this.jwa = jwa;
        this.minKeyBytes = minKeyBytes;
    }

    public MacAlgorithm jwa() {
        return jwa;
    }

    public int minKeyBytes() {
        return minKeyBytes;
    }
}
