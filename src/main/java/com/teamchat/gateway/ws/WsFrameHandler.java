package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;

/**
 * 每个连接一个实例：解析 JSON 帧，按连接串行交给 {@link WsSessionProtocol}。
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    /** 单连接排队上限，超过直接回 server_busy。 */
    static final int MAX_PENDING_FRAMES = 256;

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsSessionProtocol protocol;
    private final WsWriter wsWriter;
    private final Clock clock;

    public WsFrameHandler(ObjectMapper objectMapper,
                          SessionRegistry sessionRegistry,
                          WsSessionProtocol protocol,
                          WsWriter wsWriter,
                          Clock clock) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.protocol = protocol;
        this.wsWriter = wsWriter;
        this.clock = clock;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            log.debug("ws bad json: channel={}, err={}", ctx.channel().id().asShortText(), e.toString());
            wsWriter.writeError(ctx.channel(), "bad_json", null, null);
            ctx.close();
            return;
        }

        if (!sessionRegistry.isAuthed(ctx.channel())) {
            wsWriter.writeError(ctx.channel(), "unauthorized", msg.getRef(), msg.getTopic());
            ctx.close();
            return;
        }
        if (sessionRegistry.isExpired(ctx.channel(), clock.millis())) {
            wsWriter.writeError(ctx.channel(), "token_expired", msg.getRef(), msg.getTopic());
            ctx.close();
            return;
        }

        WsChannelSerialQueue.tryEnqueue(ctx.channel(), () -> protocol.handle(ctx.channel(), msg), MAX_PENDING_FRAMES)
                .whenComplete((v, e) -> {
                    if (e instanceof RejectedExecutionException) {
                        wsWriter.writeReplyError(ctx.channel(), msg, "server_busy");
                    } else if (e != null) {
                        log.error("ws frame failed: type={}, event={}", msg.getType(), msg.getEvent(), e);
                    }
                });
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.READER_IDLE) {
            // 客户端长时间没有任何帧（含 ping）：视为掉线
            log.debug("ws reader idle, closing: userId={}", sessionRegistry.userId(ctx.channel()));
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        protocol.onDisconnect(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error, closing: userId={}, err={}", sessionRegistry.userId(ctx.channel()), cause.toString());
        ctx.close();
    }
}
