package com.demo.sessionauth.audit;

/**
 * 审计事件类型。
 */
public enum AuthEventType {
    LOGIN("login"),
    LOGOUT("logout"),
    EVICTED("evicted"),
    EXPIRED("expired");

    private final String value;

    AuthEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
