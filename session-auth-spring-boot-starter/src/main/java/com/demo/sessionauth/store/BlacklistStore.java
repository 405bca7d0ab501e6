package com.demo.sessionauth.store;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * 管理被提前吊销的 access token，弥补 JWT 天然无状态的不足。
 * <p>
 * 黑名单条目的存活时间等于 token 的剩余寿命，到期自动消失，不会无限增长。
 */
public interface BlacklistStore {

    /**
     * 拉黑 token 直到 ttl 到期（幂等）。
     */
    void blacklist(String token, Duration ttl);

    /**
     * 每次都直接查询存储，不做本地缓存，保证吊销对所有进程立即可见。
     *
     * @throws com.demo.sessionauth.exception.StoreUnavailableException 存储不可用时
     */
    boolean isBlacklisted(String token);

    /**
     * 记录用户近期签发的 token，供批量拉黑使用。
     */
    void track(String userId, String token, Duration ttl);

    List<String> trackedTokens(String userId);

    /**
     * 从用户的记录中移除指定 token。
     */
    void untrack(String userId, Collection<String> tokens);
}
