package com.demo.sessionauth.web.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 在过滤器层直接写出 {@link ApiError}（此时还没有进入 Spring MVC，无法走 ControllerAdvice）。
 */
public class JsonResponseWriter {

    private final ObjectMapper objectMapper;

    public JsonResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * 响应已提交时不做任何事。
     */
    public void write(HttpServletResponse response, ApiError body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(body.statusCode());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }
}
