package com.demo.sessionauth.middleware;

import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.session.UserSession;

import java.util.Objects;

/**
 * 一次认证/授权判定的结果。
 */
public final class AuthDecision {

    public enum Outcome {
        /** 已认证并通过授权 */
        AUTHORIZED,
        /** 可选认证下无有效凭证，按匿名继续 */
        ANONYMOUS,
        /** 拒绝，附带错误码 */
        REJECTED
    }

    private static final AuthDecision ANONYMOUS = new AuthDecision(Outcome.ANONYMOUS, null, null, null, null);

    private final Outcome outcome;
    private final AuthContext context;
    private final UserSession session;
    private final AuthErrorCode errorCode;
    private final String message;

    private AuthDecision(Outcome outcome, AuthContext context, UserSession session,
                         AuthErrorCode errorCode, String message) {
        this.outcome = outcome;
        this.context = context;
        this.session = session;
        this.errorCode = errorCode;
        this.message = message;
    }

    public static AuthDecision authorized(AuthContext context, UserSession session) {
        return new AuthDecision(Outcome.AUTHORIZED, Objects.requireNonNull(context, "context must not be null"),
                session, null, null);
    }

    public static AuthDecision anonymous() {
        return ANONYMOUS;
    }

    public static AuthDecision rejected(AuthErrorCode errorCode) {
        return rejected(errorCode, errorCode.getDefaultMessage());
    }

    public static AuthDecision rejected(AuthErrorCode errorCode, String message) {
        Objects.requireNonNull(errorCode, "errorCode must not be null");
        return new AuthDecision(Outcome.REJECTED, null, null, errorCode,
                message == null ? errorCode.getDefaultMessage() : message);
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }

    public boolean isAuthenticated() {
        return outcome == Outcome.AUTHORIZED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public AuthContext getContext() {
        return context;
    }

    public UserSession getSession() {
        return session;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return 拒绝时的 HTTP 状态；未拒绝时为 200
     */
    public int getHttpStatus() {
        return errorCode == null ? 200 : errorCode.getHttpStatus();
    }

    @Override
    public String toString() {
        return isRejected() ? outcome + "(" + errorCode + ")" : outcome.toString();
    }
}
