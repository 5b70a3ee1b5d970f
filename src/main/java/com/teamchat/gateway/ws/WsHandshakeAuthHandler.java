package com.teamchat.gateway.ws;

import com.teamchat.auth.service.TokenManager;
import com.teamchat.auth.service.TokenVerificationException;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.enums.TokenType;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>从 Authorization: Bearer &lt;token&gt; 或 query 参数 token 里取 access token</li>
 *   <li>在 DB 线程池校验（查 token 行、黑名单、版本号），期间暂停读</li>
 *   <li>通过则把 userId/connId/过期时间绑定到 channel 再放行握手；否则回 401 并关闭</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final TokenManager tokenManager;
    private final SessionRegistry sessionRegistry;
    private final Executor dbExecutor;
    private final long timeoutMs;
    private final ZoneId zone;

    public WsHandshakeAuthHandler(String wsPath,
                                  TokenManager tokenManager,
                                  SessionRegistry sessionRegistry,
                                  Executor dbExecutor,
                                  long timeoutMs,
                                  ZoneId zone) {
        this.wsPath = wsPath;
        this.tokenManager = tokenManager;
        this.sessionRegistry = sessionRegistry;
        this.dbExecutor = dbExecutor;
        this.timeoutMs = timeoutMs;
        this.zone = zone;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            writeStatusAndClose(ctx, HttpResponseStatus.NOT_FOUND, "not_found");
            return;
        }
        if (sessionRegistry.isAuthed(ctx.channel())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeStatusAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "missing_access_token");
            return;
        }

        FullHttpRequest retained = req.retain();
        ctx.channel().config().setAutoRead(false);
        CompletableFuture
                .supplyAsync(() -> tokenManager.verify(token, TokenType.ACCESS), dbExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((verified, err) -> ctx.executor().execute(() -> {
                    ctx.channel().config().setAutoRead(true);
                    if (err != null) {
                        retained.release();
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        if (cause instanceof TokenVerificationException tve) {
                            log.debug("ws handshake rejected: reason={}", tve.getReason());
                            writeStatusAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, tve.getMessage());
                        } else {
                            log.warn("ws handshake verify failed: {}", cause.toString());
                            writeStatusAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "invalid_access_token");
                        }
                        return;
                    }
                    bind(ctx, verified);
                    ctx.fireChannelRead(retained);
                }));
    }

    private void bind(ChannelHandlerContext ctx, AuthTokenEntity token) {
        Long expMs = token.getExpiresAt() == null ? null : token.getExpiresAt().atZone(zone).toInstant().toEpochMilli();
        String connId = sessionRegistry.bind(ctx.channel(), token.getUserId(), expMs);
        log.debug("ws handshake ok: userId={}, connId={}", token.getUserId(), connId);
    }

    static String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            String t = auth.substring("Bearer ".length()).trim();
            if (!t.isEmpty()) {
                return t;
            }
        }
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        List<String> list = params.get("token");
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private static void writeStatusAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
