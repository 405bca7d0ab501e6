package com.demo.sessionauth.audit;

import com.demo.sessionauth.util.Copies;

import java.time.Instant;
import java.util.Map;

/**
 * 认证审计事件。
 *
 * @param eventType {@link AuthEventType#value()}，保留字符串形式以便调用方扩展自定义事件
 * @param metadata  附加信息，可为空
 */
public record AuthEvent(
        String userId,
        String sessionId,
        String eventType,
        boolean success,
        String ipAddress,
        String userAgent,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public AuthEvent {
        metadata = Copies.map(metadata);
    }
}
