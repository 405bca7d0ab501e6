package com.demo.sessionauth.cache;

import java.time.Duration;
import java.util.Set;

/**
 * 认证模块依赖的键值存储能力（通常由 Redis 提供）。
 * <p>
 * 约定：
 * - 单 key 写入由存储自身保证原子性，本模块不依赖多 key 事务；
 * - 连接失败、命令超时等统一抛出 {@link com.demo.sessionauth.exception.StoreUnavailableException}；
 * - 所有写入都必须带 TTL，避免数据无限增长。
 */
public interface KeyValueCache {

    /**
     * @return 值；key 不存在时返回 null
     */
    String get(String key);

    /**
     * 写入并设置过期时间（ttl 必须为正）。
     */
    void set(String key, String value, Duration ttl);

    /**
     * 删除 key（幂等）。
     */
    void delete(String key);

    boolean exists(String key);

    /**
     * 按通配模式列出 key（如 {@code session:*}）。全量扫描，只用于维护任务。
     * <p>
     * 模式语法同 Redis KEYS：{@code * ? [...]} 为通配符，{@code \} 转义。
     * 拼入外部输入时先用 {@link #escapePattern(String)} 处理。
     */
    Set<String> keys(String pattern);

    /**
     * 转义通配符，使字面量只匹配自身。
     */
    static String escapePattern(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * 剩余存活时间。
     *
     * @return key 不存在或没有过期时间时返回 null
     */
    Duration ttl(String key);
}
