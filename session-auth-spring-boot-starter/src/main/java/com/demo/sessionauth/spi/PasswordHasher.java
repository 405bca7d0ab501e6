package com.demo.sessionauth.spi;

/**
 * 密码哈希。
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean verify(String rawPassword, String hashedPassword);
}
