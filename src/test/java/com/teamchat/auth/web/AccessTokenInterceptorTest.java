package com.teamchat.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.auth.service.TokenManager;
import com.teamchat.auth.service.TokenVerificationException;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.enums.TokenType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessTokenInterceptorTest {

    private final TokenManager tokenManager = mock(TokenManager.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AccessTokenInterceptor interceptor = new AccessTokenInterceptor(tokenManager, objectMapper);

    @AfterEach
    void clear() {
        AuthContext.clear();
    }

    @Test
    void validToken_ShouldPopulateAuthContext() throws Exception {
        AuthTokenEntity token = new AuthTokenEntity();
        token.setUserId(9L);
        when(tokenManager.verify("abc", TokenType.ACCESS)).thenReturn(token);
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/channels/mine");
        req.addHeader("Authorization", "Bearer abc");

        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(AuthContext.getUserId()).isEqualTo(9L);
        assertThat(req.getAttribute(AccessTokenInterceptor.REQ_ATTR_USER_ID)).isEqualTo(9L);
    }

    @Test
    void missingHeader_ShouldWrite401() throws Exception {
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(new MockHttpServletRequest("GET", "/channels/mine"), resp, new Object())).isFalse();
        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(objectMapper.readTree(resp.getContentAsString()).get("message").asText()).isEqualTo("missing_access_token");
    }

    @Test
    void revokedToken_ShouldWrite401WithReason() throws Exception {
        when(tokenManager.verify("old", TokenType.ACCESS))
                .thenThrow(new TokenVerificationException(TokenVerificationException.Reason.REVOKED));
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/channels/mine");
        req.addHeader("Authorization", "Bearer old");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
        assertThat(objectMapper.readTree(resp.getContentAsString()).get("message").asText()).isEqualTo("token_revoked");
        assertThat(AuthContext.getUserId()).isNull();
    }
}
