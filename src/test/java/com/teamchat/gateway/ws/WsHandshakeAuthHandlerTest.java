package com.teamchat.gateway.ws;

import com.teamchat.auth.service.TokenManager;
import com.teamchat.auth.service.TokenVerificationException;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.enums.TokenType;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsHandshakeAuthHandlerTest {

    private final TokenManager tokenManager = mock(TokenManager.class);
    private final SessionRegistry sessionRegistry = new SessionRegistry();

    @Test
    void extractAccessToken_ShouldPreferBearerHeader() {
        FullHttpRequest req = request("/ws?token=fromQuery");
        req.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer fromHeader");

        assertThat(WsHandshakeAuthHandler.extractAccessToken(req)).isEqualTo("fromHeader");
        req.release();
    }

    @Test
    void extractAccessToken_ShouldFallBackToQuery() {
        FullHttpRequest req = request("/ws?token=fromQuery");

        assertThat(WsHandshakeAuthHandler.extractAccessToken(req)).isEqualTo("fromQuery");
        assertThat(WsHandshakeAuthHandler.extractAccessToken(request("/ws"))).isNull();
        req.release();
    }

    @Test
    void validToken_ShouldBindSessionAndPassRequestOn() {
        AuthTokenEntity token = new AuthTokenEntity();
        token.setUserId(42L);
        token.setExpiresAt(LocalDateTime.of(2030, 1, 1, 0, 0));
        when(tokenManager.verify("good", TokenType.ACCESS)).thenReturn(token);
        List<Object> passed = new ArrayList<>();
        EmbeddedChannel ch = channel(passed);

        ch.writeInbound(request("/ws?token=good"));
        ch.runPendingTasks();

        assertThat(sessionRegistry.userId(ch)).isEqualTo(42L);
        assertThat(sessionRegistry.connId(ch)).isNotBlank();
        assertThat(passed).hasSize(1);
        assertThat(ch.config().isAutoRead()).isTrue();
        passed.forEach(ReferenceCountUtil::release);
    }

    @Test
    void rejectedToken_ShouldAnswer401WithReason() {
        when(tokenManager.verify("old", TokenType.ACCESS))
                .thenThrow(new TokenVerificationException(TokenVerificationException.Reason.EXPIRED));
        List<Object> passed = new ArrayList<>();
        EmbeddedChannel ch = channel(passed);

        ch.writeInbound(request("/ws?token=old"));
        ch.runPendingTasks();

        FullHttpResponse resp = ch.readOutbound();
        assertThat(resp.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        assertThat(resp.content().toString(CharsetUtil.UTF_8)).isEqualTo("token_expired");
        resp.release();
        assertThat(passed).isEmpty();
        assertThat(sessionRegistry.isAuthed(ch)).isFalse();
        assertThat(ch.isActive()).isFalse();
    }

    @Test
    void missingToken_ShouldAnswer401WithoutLookup() {
        EmbeddedChannel ch = channel(new ArrayList<>());

        ch.writeInbound(request("/ws"));

        FullHttpResponse resp = ch.readOutbound();
        assertThat(resp.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        resp.release();
        verify(tokenManager, never()).verify(anyString(), eq(TokenType.ACCESS));
    }

    @Test
    void otherPath_ShouldAnswer404() {
        EmbeddedChannel ch = channel(new ArrayList<>());

        ch.writeInbound(request("/favicon.ico"));

        FullHttpResponse resp = ch.readOutbound();
        assertThat(resp.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
        resp.release();
    }

    private EmbeddedChannel channel(List<Object> passed) {
        return new EmbeddedChannel(
                new WsHandshakeAuthHandler("/ws", tokenManager, sessionRegistry, Runnable::run, 1000, ZoneOffset.UTC),
                new ChannelInboundHandlerAdapter() {
                    @Override
                    public void channelRead(ChannelHandlerContext ctx, Object msg) {
                        passed.add(msg);
                    }
                });
    }

    private static FullHttpRequest request(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }
}
