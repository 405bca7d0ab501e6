package com.demo.sessionauth.middleware;

import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * 从请求中取出 access token。
 * <p>
 * 顺序固定：Authorization 头（Bearer）→ 查询参数 → Cookie，先取到者为准。
 */
public class CredentialExtractor {

    private static final String AUTHORIZATION = "Authorization";
    private static final String BEARER = "Bearer";

    private final String queryParameter;
    private final String cookieName;

    public CredentialExtractor(String queryParameter, String cookieName) {
        this.queryParameter = Objects.requireNonNull(queryParameter, "queryParameter must not be null");
        this.cookieName = Objects.requireNonNull(cookieName, "cookieName must not be null");
    }

    /**
     * @return token；三处都没有时返回 null
     */
    public String extract(AuthRequest request) {
        String token = extractBearerToken(request.header(AUTHORIZATION));
        if (token != null) {
            return token;
        }

        String fromQuery = request.queryParameter(queryParameter);
        if (StringUtils.hasText(fromQuery)) {
            return fromQuery.trim();
        }

        String fromCookie = request.cookie(cookieName);
        if (StringUtils.hasText(fromCookie)) {
            // 登录 Cookie 与请求头同名时，值可能也带 Bearer 前缀
            String bearer = extractBearerToken(fromCookie);
            return bearer != null ? bearer : fromCookie.trim();
        }
        return null;
    }

    /**
     * 解析 "Bearer xxx"，前缀大小写不敏感，兼容少数网关写成 "Bearer:xxx"。
     */
    public static String extractBearerToken(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) return null;

        String h = authorizationHeader.trim();
        if (!h.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }

        String rest = h.substring(BEARER.length()).trim();
        if (rest.startsWith(":")) {
            rest = rest.substring(1).trim();
        }
        return rest.isEmpty() ? null : rest;
    }
}
