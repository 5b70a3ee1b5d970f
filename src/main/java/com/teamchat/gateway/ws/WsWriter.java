package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化 reply/push/error 回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonNode toPayload(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(payload);
    }

    public WsEnvelope push(String topic, String event, Object payload) {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.PUSH);
        env.setTopic(topic);
        env.setEvent(event);
        env.setPayload(toPayload(payload));
        env.setTs(clock.millis());
        return env;
    }

    public ChannelFuture writeOk(Channel ch, WsEnvelope request, Object payload) {
        WsEnvelope env = reply(request, WsEnvelope.STATUS_OK);
        env.setPayload(toPayload(payload));
        return write(ch, env);
    }

    public ChannelFuture writeReplyError(Channel ch, WsEnvelope request, String reason) {
        WsEnvelope env = reply(request, WsEnvelope.STATUS_ERROR);
        env.setReason(reason);
        return write(ch, env);
    }

    public ChannelFuture writeError(Channel ch, String reason, String ref, String topic) {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.ERROR);
        env.setReason(reason);
        env.setRef(ref);
        env.setTopic(topic);
        env.setTs(clock.millis());
        return write(ch, env);
    }

    public ChannelFuture writePong(Channel ch, WsEnvelope request) {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.PONG);
        env.setRef(request == null ? null : request.getRef());
        env.setTs(clock.millis());
        return write(ch, env);
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (ch.eventLoop().inEventLoop()) {
            return doWrite(ch, env);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> doWrite(ch, env).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    private ChannelFuture doWrite(Channel ch, WsEnvelope env) {
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("channel_inactive"));
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(env);
        } catch (Exception e) {
            log.error("ws envelope encode failed: type={}, event={}", env.getType(), env.getEvent(), e);
            return ch.newFailedFuture(e);
        }
        return ch.writeAndFlush(new TextWebSocketFrame(json));
    }

    private WsEnvelope reply(WsEnvelope request, String status) {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.REPLY);
        env.setEvent(status);
        if (request != null) {
            env.setRef(request.getRef());
            env.setTopic(request.getTopic());
        }
        env.setTs(clock.millis());
        return env;
    }
}
