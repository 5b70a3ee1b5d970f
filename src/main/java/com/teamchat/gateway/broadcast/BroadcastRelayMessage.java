package com.teamchat.gateway.broadcast;

import com.teamchat.gateway.ws.WsEnvelope;

/**
 * 跨实例转发的广播。origin 为发出实例，接收方据此跳过自己发的消息。
 */
public record BroadcastRelayMessage(
        String origin,
        String topic,
        WsEnvelope envelope,
        Long ts
) {
}
