package com.demo.sessionauth.session;

/**
 * 全量扫描得到的会话统计。
 */
public record SessionStats(int totalSessions, int activeSessions, int expiredSessions) {
}
