package com.demo.sessionauth.session;

import java.time.Instant;

/**
 * 服务端会话记录，以 JSON 形式保存在 {@code session:<sessionId>}。
 */
public class UserSession {

    private String sessionId;
    private String userId;
    private String deviceId;
    private boolean deviceVerified;
    private DeviceInfo deviceInfo;
    private Instant createdAt;
    private Instant lastActiveAt;
    private Instant expiresAt;
    private boolean active;

    public UserSession() {
    }

    public UserSession(String sessionId, String userId, String deviceId, DeviceInfo deviceInfo,
                       Instant createdAt, Instant expiresAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.deviceId = deviceId;
        this.deviceInfo = deviceInfo;
        this.createdAt = createdAt;
        this.lastActiveAt = createdAt;
        this.expiresAt = expiresAt;
        this.active = true;
    }

    /**
     * 严格晚于 expiresAt 才算过期。
     */
    public boolean isExpired(Instant now) {
        return expiresAt == null || now.isAfter(expiresAt);
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public boolean isDeviceVerified() {
        return deviceVerified;
    }

    public void setDeviceVerified(boolean deviceVerified) {
        this.deviceVerified = deviceVerified;
    }

    public DeviceInfo getDeviceInfo() {
        return deviceInfo;
    }

    public void setDeviceInfo(DeviceInfo deviceInfo) {
        this.deviceInfo = deviceInfo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    public void setLastActiveAt(Instant lastActiveAt) {
        this.lastActiveAt = lastActiveAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
