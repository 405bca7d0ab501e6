package com.demo.sessionauth.middleware;

/**
 * 认证中间件看到的请求视图，与具体 Web 框架解耦。
 * Servlet 环境下的实现见 {@link com.demo.sessionauth.filter.ServletAuthRequest}。
 */
public interface AuthRequest {

    String header(String name);

    String queryParameter(String name);

    String cookie(String name);

    /**
     * 客户端地址；取不到时返回 null。
     */
    String remoteAddress();

    Object getAttribute(String name);

    void setAttribute(String name, Object value);
}
