package com.demo.sessionauth.support;

import com.demo.sessionauth.middleware.AuthRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于 Map 的请求视图，供中间件测试使用。
 */
public class MapAuthRequest implements AuthRequest {

    private final Map<String, String> headers = new HashMap<>();
    private final Map<String, String> query = new HashMap<>();
    private final Map<String, String> cookies = new HashMap<>();
    private final Map<String, Object> attributes = new HashMap<>();
    private String remoteAddress;

    public MapAuthRequest header(String name, String value) {
        headers.put(name.toLowerCase(), value);
        return this;
    }

    public MapAuthRequest query(String name, String value) {
        query.put(name, value);
        return this;
    }

    public MapAuthRequest cookie(String name, String value) {
        cookies.put(name, value);
        return this;
    }

    public MapAuthRequest remote(String address) {
        this.remoteAddress = address;
        return this;
    }

    public MapAuthRequest bearer(String token) {
        return header("Authorization", "Bearer " + token);
    }

    @Override
    public String header(String name) {
        return headers.get(name.toLowerCase());
    }

    @Override
    public String queryParameter(String name) {
        return query.get(name);
    }

    @Override
    public String cookie(String name) {
        return cookies.get(name);
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }
}
