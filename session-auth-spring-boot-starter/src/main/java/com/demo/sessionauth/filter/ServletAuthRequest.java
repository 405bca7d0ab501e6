package com.demo.sessionauth.filter;

import com.demo.sessionauth.middleware.AuthRequest;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;

/**
 * {@link HttpServletRequest} 适配为 {@link AuthRequest}。
 */
public class ServletAuthRequest implements AuthRequest {

    private final HttpServletRequest request;

    public ServletAuthRequest(HttpServletRequest request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }

    @Override
    public String queryParameter(String name) {
        return request.getParameter(name);
    }

    @Override
    public String cookie(String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) return null;
        for (Cookie c : cookies) {
            if (c != null && name.equals(c.getName())) {
                return c.getValue();
            }
        }
        return null;
    }

    @Override
    public String remoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public Object getAttribute(String name) {
        return request.getAttribute(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        request.setAttribute(name, value);
    }
}
