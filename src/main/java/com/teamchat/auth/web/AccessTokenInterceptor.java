package com.teamchat.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.auth.service.TokenManager;
import com.teamchat.auth.service.TokenVerificationException;
import com.teamchat.common.api.ApiCodes;
import com.teamchat.common.api.Result;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.enums.TokenType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * 受保护接口的鉴权：必须带 Authorization: Bearer &lt;accessToken&gt;。
 *
 * <p>校验通过后把 userId 写入 request attribute 与 {@link AuthContext}；失败时直接写 401 的 Result JSON。</p>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final TokenManager tokenManager;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(TokenManager tokenManager, ObjectMapper objectMapper) {
        this.tokenManager = tokenManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String token = bearerToken(request);
        if (token == null) {
            writeUnauthorized(response, "missing_access_token");
            return false;
        }
        try {
            AuthTokenEntity verified = tokenManager.verify(token, TokenType.ACCESS);
            request.setAttribute(REQ_ATTR_USER_ID, verified.getUserId());
            AuthContext.set(verified.getUserId(), token);
            return true;
        } catch (TokenVerificationException e) {
            log.debug("access token rejected: path={}, reason={}", request.getRequestURI(), e.getReason());
            writeUnauthorized(response, e.getMessage());
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    static String bearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return null;
        }
        String token = header.substring("Bearer ".length()).trim();
        return token.isEmpty() ? null : token;
    }

    private void writeUnauthorized(HttpServletResponse response, String reason) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason)));
    }
}
