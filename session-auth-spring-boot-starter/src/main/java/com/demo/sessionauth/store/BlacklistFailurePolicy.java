package com.demo.sessionauth.store;

/**
 * 黑名单查询时缓存不可用的处理策略。
 */
public enum BlacklistFailurePolicy {

    /**
     * 视为“未拉黑”，优先保证可用性（默认）。
     */
    FAIL_OPEN,

    /**
     * 视为校验失败，拒绝请求。
     */
    FAIL_CLOSED
}
